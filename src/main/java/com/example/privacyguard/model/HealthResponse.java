package com.example.privacyguard.model;

import java.util.List;

public record HealthResponse(String status, String version, boolean modelsLoaded, List<CapabilityStatus> capabilities) {

    public record CapabilityStatus(DetectionCategory category, String state, String backend) {
    }
}
