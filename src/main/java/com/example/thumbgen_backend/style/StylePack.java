package com.example.thumbgen_backend.style;

import java.util.List;
import java.util.Set;

/**
 * Immutable, statically registered style configuration.
 *
 * @param id                  registry key.
 * @param name                display name.
 * @param promptPrefix        high-impact descriptors placed before the scene text.
 * @param promptSuffix        descriptors placed after the scene text.
 * @param negativeAdditions   comma separated negative-prompt terms.
 * @param generationParams    provider parameter overrides.
 * @param postProcessing      ordered post-processing recipe.
 * @param recommendedProvider provider that renders this style best, or {@link #ANY_PROVIDER}.
 * @param priority            higher wins when packs conflict.
 * @param usePostProcessing   whether the recipe is actually run.
 * @param conflictsWith       ids of packs that cannot be combined with this one.
 */
public record StylePack(String id,
                        String name,
                        String promptPrefix,
                        String promptSuffix,
                        String negativeAdditions,
                        GenerationParams generationParams,
                        List<PostProcessingStep> postProcessing,
                        String recommendedProvider,
                        int priority,
                        boolean usePostProcessing,
                        Set<String> conflictsWith) {

    public static final String ANY_PROVIDER = "any";

    public StylePack {
        postProcessing = List.copyOf(postProcessing);
        conflictsWith = Set.copyOf(conflictsWith);
        generationParams = generationParams == null ? GenerationParams.NONE : generationParams;
    }

    public boolean conflictsWith(String otherId) {
        return conflictsWith.contains(otherId);
    }

    public boolean hasProviderPreference() {
        return recommendedProvider != null && !ANY_PROVIDER.equals(recommendedProvider);
    }
}
