package com.example.privacyguard.model;

import java.util.Objects;

/**
 * Raw image payload paired with the name it was uploaded under.
 */
public record ImageUpload(byte[] content, String filename) {

    public ImageUpload {
        Objects.requireNonNull(content, "content");
        filename = filename == null || filename.isBlank() ? "unknown" : filename;
    }
}
