package com.example.thumbgen_backend.dto;

import java.util.List;
import java.util.UUID;

public record GenerateThumbnailResponse(
        UUID jobId,
        String status,
        List<DispatchedPrediction> predictions,
        int requestedVariants
) {
    public record DispatchedPrediction(UUID predictionId, String externalId, String variationNote) {
    }
}
