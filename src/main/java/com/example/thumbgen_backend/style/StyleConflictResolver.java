package com.example.thumbgen_backend.style;

import jakarta.annotation.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves requested style packs into one consistent configuration and composes the
 * positive and negative prompts from it. Pure: no I/O, no shared mutable state.
 */
@Component
public class StyleConflictResolver {

    public static final String UNIVERSAL_PROMPT_SUFFIX =
            "absolutely no text, no words, no letters, no numbers, no writing, no captions, "
                    + "no watermarks, no logos, no signs anywhere in the image";

    public static final String UNIVERSAL_NEGATIVE_PROMPT =
            "text, words, letters, numbers, writing, caption, watermark, logo, sign, label, gibberish text, "
                    + "random letters, hands, fingers, visible hands, palm, wrist, asymmetrical eyes, missing pupil, "
                    + "extra teeth, melted face, distorted features, uncanny valley, duplicate objects, extra limbs, "
                    + "deformed, blurry, low quality";

    private final StylePackRegistry registry;

    public StyleConflictResolver(StylePackRegistry registry) {
        this.registry = registry;
    }

    /**
     * Greedy priority resolution. Packs are visited by descending priority (ties keep request order);
     * a pack is dropped when an already kept pack lists it in its conflicts.
     */
    public List<StylePack> resolve(List<StylePack> requested) {
        if (requested.size() <= 1) {
            return List.copyOf(requested);
        }
        List<StylePack> sorted = new ArrayList<>(requested);
        sorted.sort(Comparator.comparingInt(StylePack::priority).reversed());

        List<StylePack> kept = new ArrayList<>();
        Set<String> excluded = new HashSet<>();
        for (StylePack pack : sorted) {
            if (excluded.contains(pack.id())) {
                continue;
            }
            kept.add(pack);
            excluded.addAll(pack.conflictsWith());
        }
        return kept;
    }

    /**
     * Composes a full configuration for the requested pack ids.
     *
     * @param requestedPackIds ids or aliases; unknown ids raise {@link IllegalArgumentException}.
     * @param lead             text placed before every pack prefix (trigger words), may be blank.
     * @param scene            the scene description.
     * @param baseNegative     base negative list, may be blank.
     * @param marker           mandatory trailing marker kept through clamping, may be blank.
     * @param maxChars         character budget of the positive prompt.
     */
    public ComposedStyle compose(List<String> requestedPackIds,
                                 @Nullable String lead,
                                 String scene,
                                 @Nullable String baseNegative,
                                 @Nullable String marker,
                                 int maxChars) {
        Map<String, StylePack> requested = new LinkedHashMap<>();
        for (String id : requestedPackIds) {
            StylePack pack = registry.require(id);
            requested.putIfAbsent(pack.id(), pack);
        }
        List<StylePack> kept = resolve(new ArrayList<>(requested.values()));
        List<String> keptIds = kept.stream().map(StylePack::id).toList();
        List<String> removedIds = requested.keySet().stream().filter(id -> !keptIds.contains(id)).toList();

        String positive = clamp(positivePrompt(kept, lead, scene, marker), maxChars, marker);
        String negative = negativePrompt(kept, baseNegative);

        List<PostProcessingStep> steps = new ArrayList<>();
        for (StylePack pack : kept) {
            if (pack.usePostProcessing()) {
                steps.addAll(pack.postProcessing());
            }
        }

        String provider = kept.stream()
                .filter(StylePack::hasProviderPreference)
                .map(StylePack::recommendedProvider)
                .findFirst()
                .orElse(null);

        GenerationParams params = GenerationParams.NONE;
        for (StylePack pack : kept) {
            params = params.orElse(pack.generationParams());
        }

        return new ComposedStyle(
                new ArrayList<>(requested.keySet()),
                keptIds,
                removedIds,
                positive,
                negative,
                !steps.isEmpty(),
                steps,
                provider,
                params
        );
    }

    String positivePrompt(List<StylePack> kept, @Nullable String lead, String scene, @Nullable String marker) {
        List<String> parts = new ArrayList<>();
        if (lead != null && !lead.isBlank()) {
            parts.add(lead);
        }
        for (StylePack pack : kept) {
            if (!pack.promptPrefix().isBlank()) {
                parts.add(pack.promptPrefix());
            }
        }
        parts.add(scene);
        for (StylePack pack : kept) {
            if (pack.promptSuffix() != null && !pack.promptSuffix().isBlank()) {
                parts.add(pack.promptSuffix());
            }
        }
        if (!scene.toLowerCase(Locale.ROOT).contains("no text")) {
            parts.add(UNIVERSAL_PROMPT_SUFFIX);
        }
        if (marker != null && !marker.isBlank()) {
            parts.add(marker);
        }
        return collapseWhitespace(String.join(" ", parts));
    }

    String negativePrompt(List<StylePack> kept, @Nullable String baseNegative) {
        List<String> sources = new ArrayList<>();
        if (baseNegative != null && !baseNegative.isBlank()) {
            sources.add(baseNegative);
        }
        for (StylePack pack : kept) {
            if (pack.negativeAdditions() != null && !pack.negativeAdditions().isBlank()) {
                sources.add(pack.negativeAdditions());
            }
        }
        sources.add(UNIVERSAL_NEGATIVE_PROMPT);

        Map<String, String> terms = new LinkedHashMap<>();
        for (String source : sources) {
            for (String raw : source.split(",")) {
                String term = raw.trim();
                if (!term.isEmpty()) {
                    terms.putIfAbsent(term.toLowerCase(Locale.ROOT), term);
                }
            }
        }
        return String.join(", ", new LinkedHashSet<>(terms.values()));
    }

    /**
     * Truncates to {@code maxChars}, re-appending the marker so it always ends the prompt.
     */
    public static String clamp(String prompt, int maxChars, @Nullable String marker) {
        if (prompt.length() <= maxChars) {
            return prompt;
        }
        String suffix = marker == null ? "" : marker.trim();
        int keep = maxChars - suffix.length() - 1;
        if (keep <= 0) {
            return suffix.substring(0, Math.min(suffix.length(), maxChars));
        }
        String head = prompt.substring(0, keep).trim();
        return suffix.isEmpty() ? head : head + " " + suffix;
    }

    private static String collapseWhitespace(String value) {
        return value.replaceAll("\\s+", " ").trim();
    }
}
