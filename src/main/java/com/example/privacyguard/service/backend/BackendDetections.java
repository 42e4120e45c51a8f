package com.example.privacyguard.service.backend;

import java.util.List;

/**
 * Raw detections together with the backend that produced them, so callers can apply the
 * matching confidence band.
 */
public record BackendDetections(String backendName, ConfidenceBand band, List<RawDetection> detections) {

    public BackendDetections {
        detections = List.copyOf(detections);
    }

    public static BackendDetections unavailable() {
        return new BackendDetections("none", new ConfidenceBand(0.0, 1.0), List.of());
    }

    public boolean isEmpty() {
        return detections.isEmpty();
    }
}
