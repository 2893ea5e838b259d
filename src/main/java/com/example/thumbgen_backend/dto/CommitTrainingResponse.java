package com.example.thumbgen_backend.dto;

import java.util.UUID;

public record CommitTrainingResponse(UUID identityModelId, String status, long photoCount) {
}
