package com.example.thumbgen_backend.dto;

import java.util.UUID;

public record VariationResponse(UUID jobId, UUID parentJobId, String status, UUID predictionId) {
}
