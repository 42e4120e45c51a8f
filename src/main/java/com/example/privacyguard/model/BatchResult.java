package com.example.privacyguard.model;

import java.util.List;

/**
 * Aggregated outcome of one batch. Images that could not be processed are only counted in
 * {@code skippedImages}.
 */
public record BatchResult(List<ProcessedResult> results, double totalProcessingTimeMs, int totalDetections,
                          int skippedImages) {

    public BatchResult {
        results = List.copyOf(results);
    }
}
