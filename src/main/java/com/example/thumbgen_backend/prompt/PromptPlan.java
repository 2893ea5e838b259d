package com.example.thumbgen_backend.prompt;

import com.example.thumbgen_backend.style.PostProcessingStep;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Composed prompts for one request plus the style resolution they were built from.
 *
 * @param fallback true when the deterministic variants were used instead of an LLM plan.
 */
public record PromptPlan(List<PromptVariant> variants,
                         boolean fallback,
                         List<String> keptPackIds,
                         List<String> removedPackIds,
                         List<PostProcessingStep> postProcessing,
                         @Nullable String recommendedProvider) {

    public PromptPlan {
        variants = List.copyOf(variants);
        keptPackIds = List.copyOf(keptPackIds);
        removedPackIds = List.copyOf(removedPackIds);
        postProcessing = List.copyOf(postProcessing);
    }
}
