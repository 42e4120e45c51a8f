package com.example.privacyguard.service;

/**
 * Raised for corrupt or unsupported image payloads.
 */
public class ImageDecodeException extends RuntimeException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
