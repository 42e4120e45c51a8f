package com.example.privacyguard.model;

/**
 * Per-batch redaction options. Intensity and sensitivity are clamped to [0,100] on construction.
 */
public record DetectionOptions(
        BlurMode blurMode,
        int intensity,
        boolean detectFaces,
        boolean detectPlates,
        int sensitivity,
        String emojiKey) {

    public static final int DEFAULT_INTENSITY = 80;
    public static final int DEFAULT_SENSITIVITY = 60;
    public static final String DEFAULT_EMOJI_KEY = "smile";

    public DetectionOptions {
        blurMode = blurMode == null ? BlurMode.GAUSSIAN : blurMode;
        intensity = clampPercent(intensity);
        sensitivity = clampPercent(sensitivity);
        emojiKey = emojiKey == null || emojiKey.isBlank() ? DEFAULT_EMOJI_KEY : emojiKey.trim();
    }

    public static DetectionOptions defaults() {
        return new DetectionOptions(BlurMode.GAUSSIAN, DEFAULT_INTENSITY, true, true, DEFAULT_SENSITIVITY, DEFAULT_EMOJI_KEY);
    }

    public static int clampPercent(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
