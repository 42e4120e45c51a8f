package com.example.privacyguard.service.backend;

/**
 * Range of confidence thresholds a single backend operates in. Sensitivity 0 maps to
 * {@code max} (strictest), sensitivity 100 maps to {@code min} (most permissive).
 */
public record ConfidenceBand(double min, double max) {

    public ConfidenceBand {
        if (min < 0.0 || max > 1.0 || min > max) {
            throw new IllegalArgumentException("Invalid confidence band [" + min + ", " + max + "]");
        }
    }

    public double thresholdFor(int sensitivity) {
        int clamped = Math.max(0, Math.min(100, sensitivity));
        return max - (max - min) * clamped / 100.0;
    }
}
