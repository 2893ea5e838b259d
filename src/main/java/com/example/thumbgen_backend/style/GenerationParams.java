package com.example.thumbgen_backend.style;

import jakarta.annotation.Nullable;

/**
 * Provider parameter overrides contributed by a style pack. Null fields are left to the model default.
 */
public record GenerationParams(@Nullable Double guidanceScale,
                               @Nullable Integer inferenceSteps,
                               @Nullable String stylePreset) {

    public static final GenerationParams NONE = new GenerationParams(null, null, null);

    public static GenerationParams guidance(double guidanceScale) {
        return new GenerationParams(guidanceScale, null, null);
    }

    public boolean isEmpty() {
        return guidanceScale == null && inferenceSteps == null && stylePreset == null;
    }

    /**
     * Fills fields missing here from {@code lower}; values already set win.
     */
    public GenerationParams orElse(GenerationParams lower) {
        return new GenerationParams(
                guidanceScale != null ? guidanceScale : lower.guidanceScale(),
                inferenceSteps != null ? inferenceSteps : lower.inferenceSteps(),
                stylePreset != null ? stylePreset : lower.stylePreset()
        );
    }
}
