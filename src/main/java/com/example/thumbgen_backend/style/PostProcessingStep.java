package com.example.thumbgen_backend.style;

/**
 * One deterministic image filter applied after generation. Intensity is 0-100.
 */
public record PostProcessingStep(PostProcessingType type, int intensity) {

    public static PostProcessingStep of(PostProcessingType type, int intensity) {
        return new PostProcessingStep(type, intensity);
    }

    public String label() {
        return type.key() + ":" + intensity;
    }
}
