package com.example.thumbgen_backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Img2img request. {@code strength} defaults to 0.75, {@code prompt} to the parent prompt plus " (variation)".
 */
public record CreateVariationRequest(
        @NotBlank String ownerExternalSubject,
        @NotNull UUID parentJobId,
        @NotBlank String inputImageUrl,
        Double strength,
        String prompt
) {
}
