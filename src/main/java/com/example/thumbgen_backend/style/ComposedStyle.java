package com.example.thumbgen_backend.style;

import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Result of resolving a set of requested style packs against the registry.
 */
public record ComposedStyle(List<String> requestedPackIds,
                            List<String> keptPackIds,
                            List<String> removedPackIds,
                            String positivePrompt,
                            String negativePrompt,
                            boolean postProcessingRequired,
                            List<PostProcessingStep> postProcessingSteps,
                            @Nullable String recommendedProvider,
                            GenerationParams generationParams) {

    public ComposedStyle {
        requestedPackIds = List.copyOf(requestedPackIds);
        keptPackIds = List.copyOf(keptPackIds);
        removedPackIds = List.copyOf(removedPackIds);
        postProcessingSteps = List.copyOf(postProcessingSteps);
    }
}
