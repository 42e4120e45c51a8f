package com.example.privacyguard.service.backend;

/**
 * Raised when a backend cannot load its weights. Recovered by the adapter through fallback.
 */
public class BackendLoadException extends RuntimeException {

    public BackendLoadException(String message) {
        super(message);
    }

    public BackendLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
