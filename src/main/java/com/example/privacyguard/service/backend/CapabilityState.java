package com.example.privacyguard.service.backend;

public enum CapabilityState {
    UNLOADED,
    LOADED_PRIMARY,
    LOADED_FALLBACK,
    UNAVAILABLE
}
