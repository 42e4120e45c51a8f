package com.example.privacyguard.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Redaction output for a single uploaded image")
public record ProcessedResult(
        @Schema(description = "Short random identifier of the processed image", example = "3f9a1c2e") String imageId,
        @Schema(description = "Original name of the processed file", example = "street.jpg") String originalFilename,
        @Schema(description = "Redacted image as an embeddable data URI") String processedImage,
        @Schema(description = "Regions that were detected and redacted") List<BoundingBox> detections,
        @Schema(description = "Time spent on this image in milliseconds", example = "182.4") double processingTimeMs) {

    public ProcessedResult {
        detections = List.copyOf(detections);
    }
}
