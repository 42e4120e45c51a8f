package com.example.privacyguard.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Aggregated response for a redaction request")
public record ProcessingResponse(
        @Schema(description = "Whether the batch was processed") boolean success,
        @Schema(description = "Human readable summary", example = "Successfully processed 2 image(s)") String message,
        @Schema(description = "Collection of per-image results") List<ProcessedResult> results,
        @Schema(description = "Wall time of the whole batch in milliseconds") double totalProcessingTimeMs,
        @Schema(description = "Number of images that were redacted") int imagesProcessed,
        @Schema(description = "Number of regions detected across the batch") int totalDetections) {
}
