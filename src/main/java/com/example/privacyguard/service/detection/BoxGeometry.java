package com.example.privacyguard.service.detection;

import com.example.privacyguard.model.BoundingBox;
import com.example.privacyguard.model.DetectionCategory;

import java.util.Optional;

/**
 * Integer rectangle arithmetic shared by detection and redaction. Every method returns
 * {@link Optional#empty()} instead of a degenerate box.
 */
public final class BoxGeometry {

    private BoxGeometry() {
    }

    /**
     * Intersects a rectangle with the image area.
     */
    public static Optional<BoundingBox> clamp(int x, int y, int width, int height, double confidence,
                                              DetectionCategory category, int imageWidth, int imageHeight) {
        int left = Math.max(0, x);
        int top = Math.max(0, y);
        int right = Math.min(imageWidth, x + width);
        int bottom = Math.min(imageHeight, y + height);
        if (right - left <= 0 || bottom - top <= 0) {
            return Optional.empty();
        }
        double score = Math.max(0.0, Math.min(1.0, confidence));
        return Optional.of(new BoundingBox(left, top, right - left, bottom - top, score, category));
    }

    public static Optional<BoundingBox> clamp(BoundingBox box, int imageWidth, int imageHeight) {
        int left = Math.max(0, box.x());
        int top = Math.max(0, box.y());
        int right = Math.min(imageWidth, box.right());
        int bottom = Math.min(imageHeight, box.bottom());
        if (right - left <= 0 || bottom - top <= 0) {
            return Optional.empty();
        }
        return Optional.of(box.withBounds(left, top, right - left, bottom - top));
    }

    /**
     * Grows the box by {@code floor(min(width, height) * fraction)} on every edge, then clamps.
     */
    public static BoundingBox pad(BoundingBox box, double fraction, int imageWidth, int imageHeight) {
        int padding = (int) Math.floor(Math.min(box.width(), box.height()) * fraction);
        if (padding <= 0) {
            return box;
        }
        int left = Math.max(0, box.x() - padding);
        int top = Math.max(0, box.y() - padding);
        int right = Math.min(imageWidth, box.right() + padding);
        int bottom = Math.min(imageHeight, box.bottom() + padding);
        return box.withBounds(left, top, right - left, bottom - top);
    }

    /**
     * Erodes every edge inward by {@code floor(dimension * fraction)}.
     *
     * @return empty when the erosion collapses width or height
     */
    public static Optional<BoundingBox> shrink(BoundingBox box, double fraction) {
        int dx = (int) Math.floor(box.width() * fraction);
        int dy = (int) Math.floor(box.height() * fraction);
        int width = box.width() - 2 * dx;
        int height = box.height() - 2 * dy;
        if (width <= 0 || height <= 0) {
            return Optional.empty();
        }
        return Optional.of(box.withBounds(box.x() + dx, box.y() + dy, width, height));
    }
}
