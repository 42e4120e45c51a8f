package com.example.privacyguard.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Objects;

/**
 * Axis-aligned rectangle describing a detected privacy-sensitive region inside a source image.
 * Coordinates follow the image pixel grid with the origin located in the top-left corner.
 */
@Schema(description = "Axis-aligned rectangle describing a detected region")
public record BoundingBox(
        @Schema(description = "X coordinate of the top-left corner", example = "42") int x,
        @Schema(description = "Y coordinate of the top-left corner", example = "128") int y,
        @Schema(description = "Bounding box width in pixels", example = "180") int width,
        @Schema(description = "Bounding box height in pixels", example = "60") int height,
        @Schema(description = "Detector confidence in [0,1]", example = "0.87") double confidence,
        @Schema(description = "Detected category", example = "face") DetectionCategory category,
        @Schema(description = "Whether the region gets redacted", example = "true") boolean enabled) {

    public BoundingBox {
        if (width <= 0) {
            throw new IllegalArgumentException("Bounding box width must be positive");
        }
        if (height <= 0) {
            throw new IllegalArgumentException("Bounding box height must be positive");
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Bounding box confidence must be within [0,1]: " + confidence);
        }
        Objects.requireNonNull(category, "category");
    }

    public BoundingBox(int x, int y, int width, int height, double confidence, DetectionCategory category) {
        this(x, y, width, height, confidence, category, true);
    }

    public BoundingBox withBounds(int newX, int newY, int newWidth, int newHeight) {
        return new BoundingBox(newX, newY, newWidth, newHeight, confidence, category, enabled);
    }

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }
}
