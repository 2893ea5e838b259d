package com.example.thumbgen_backend.prompt;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Structured reply expected from the LLM. Bounds are enforced with Bean Validation.
 */
public record LlmVariantPlan(
        @NotNull @Size(min = 1, max = 4) List<@Valid @NotNull Variant> variants
) {

    public record Variant(
            @NotNull @Size(min = 1, max = 80) String variationNote,
            @NotNull @Size(min = 1, max = 180) String scene,
            @NotNull @Size(min = 1, max = 180) String composition,
            @NotNull @Size(min = 1, max = 120) String lighting,
            @NotNull @Size(min = 1, max = 140) String background,
            @NotNull @Size(min = 1, max = 120) String camera,
            @NotNull @Size(min = 1, max = 140) String props,
            @Size(max = 12) List<@NotNull @Size(min = 1, max = 60) String> avoid
    ) {
        public Variant {
            avoid = avoid == null ? List.of() : avoid;
        }
    }
}
