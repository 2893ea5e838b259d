package com.example.thumbgen_backend.prompt;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic per-index variant table used whenever the LLM plan is unavailable.
 */
final class FallbackVariants {

    private static final String[] NOTES = {
            "Tight close-up",
            "Medium shot with prop",
            "More negative space",
            "Dramatic angle / motion"
    };

    private static final String[] COMPOSITIONS = {
            "tight close-up, subject fills frame, strong focal point",
            "medium shot with one clear prop, clean framing",
            "clear subject + generous negative space on one side",
            "dynamic angle, energetic framing, strong diagonals"
    };

    static final int SCENE_MAX_CHARS = 180;

    private FallbackVariants() {
    }

    static List<LlmVariantPlan.Variant> build(String userText, int count) {
        String scene = userText.length() > SCENE_MAX_CHARS ? userText.substring(0, SCENE_MAX_CHARS) : userText;
        List<LlmVariantPlan.Variant> variants = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int idx = Math.min(i, NOTES.length - 1);
            variants.add(new LlmVariantPlan.Variant(
                    NOTES[idx],
                    scene,
                    COMPOSITIONS[idx],
                    "high contrast, studio lighting, crisp highlights",
                    "simple background, uncluttered, high separation",
                    "sharp focus, shallow depth of field",
                    "minimal props that reinforce the idea",
                    List.of()
            ));
        }
        return variants;
    }
}
