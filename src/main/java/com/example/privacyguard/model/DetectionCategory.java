package com.example.privacyguard.model;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Detection capability. Each category is served by its own backend chain.
 */
@Schema(description = "Kind of privacy-sensitive region", enumAsRef = true)
public enum DetectionCategory {
    FACE("face"),
    LICENSE_PLATE("license_plate");

    private final String value;

    DetectionCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
