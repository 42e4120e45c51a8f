package com.example.privacyguard.service.backend;

/**
 * Raised when a loaded backend fails on one image.
 */
public class BackendInferenceException extends RuntimeException {

    public BackendInferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
