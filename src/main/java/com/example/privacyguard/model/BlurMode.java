package com.example.privacyguard.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BlurMode {
    GAUSSIAN("gaussian"),
    PIXELATION("pixelation"),
    EMOJI("emoji");

    private final String value;

    BlurMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a caller supplied mode name. Blank or unknown names resolve to {@link #GAUSSIAN}.
     */
    public static BlurMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return GAUSSIAN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (BlurMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        return GAUSSIAN;
    }
}
