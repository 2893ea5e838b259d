package com.example.thumbgen_backend.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Create-generation request.
 *
 * <p>{@code memeStyle} ({@code off} for none) and {@code visualStyle} ({@code auto} for none) select style packs;
 * a meme pack wins over a visual pack. {@code identityModelId} is optional: when identity is requested without it,
 * the caller's own model is used.</p>
 */
public record GenerateThumbnailRequest(
        @NotBlank String ownerExternalSubject,
        @NotBlank String style,
        @NotBlank @Size(max = 2000) String promptText,
        @Min(1) @Max(4) Integer variantCount,
        boolean useIdentity,
        UUID identityModelId,
        String memeStyle,
        String visualStyle
) {
    public int variantCountOrDefault() {
        return variantCount == null ? 1 : variantCount;
    }
}
