package com.example.thumbgen_backend.style;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link StyleConflictResolver} against the default pack table.
 */
class StyleConflictResolverTest {

    private final StyleConflictResolver resolver = new StyleConflictResolver(new StylePackRegistry());

    private final StylePackRegistry registry = new StylePackRegistry();

    @Test
    void emptyRequestResolvesToEmpty() {
        assertThat(resolver.resolve(List.of())).isEmpty();
    }

    @Test
    void lonePackIsKeptEvenWhenOthersWouldOutrankIt() {
        StylePack photoreal = registry.require("photorealistic");

        assertThat(resolver.resolve(List.of(photoreal))).containsExactly(photoreal);

        ComposedStyle composed = resolver.compose(List.of("photorealistic"), "", "a cat", null, null, 700);
        assertThat(composed.keptPackIds()).containsExactly("photorealistic");
        assertThat(composed.removedPackIds()).isEmpty();
    }

    @Test
    void resolutionDoesNotDependOnRequestOrder() {
        List<StylePack> forward = resolver.resolve(List.of(registry.require("cinematic"), registry.require("deepFried")));
        List<StylePack> backward = resolver.resolve(List.of(registry.require("deepFried"), registry.require("cinematic")));

        assertThat(forward).extracting(StylePack::id).containsExactly("deepFried");
        assertThat(backward).isEqualTo(forward);
    }

    @Test
    void higherPriorityPackDropsConflictingPack() {
        ComposedStyle composed = resolver.compose(List.of("photoreal", "deepFried"), "", "a cat", null, null, 700);

        assertThat(composed.requestedPackIds()).containsExactly("photorealistic", "deepFried");
        assertThat(composed.keptPackIds()).containsExactly("deepFried");
        assertThat(composed.removedPackIds()).containsExactly("photorealistic");
        assertThat(composed.postProcessingRequired()).isTrue();
        assertThat(composed.postProcessingSteps()).hasSize(7);
    }

    @Test
    void compatiblePacksMergeByPriority() {
        ComposedStyle composed = resolver.compose(List.of("cinematic", "comic-ink"), "", "a chase", null, null, 700);

        assertThat(composed.keptPackIds()).containsExactly("comic-ink", "cinematic");
        assertThat(composed.removedPackIds()).isEmpty();
        assertThat(composed.recommendedProvider()).isEqualTo("stability");
        assertThat(composed.generationParams()).isEqualTo(new GenerationParams(8.0, null, "cinematic"));
        assertThat(composed.postProcessingRequired()).isFalse();
        assertThat(composed.positivePrompt()).startsWith("comic book ink art").contains("cinematic film still");
    }

    @Test
    void noPacksStillAppendsUniversalTerms() {
        ComposedStyle composed = resolver.compose(List.of(), "LEAD", "a dog on a skateboard", "Text, blurry, red hat", null, 700);

        assertThat(composed.positivePrompt())
                .isEqualTo("LEAD a dog on a skateboard " + StyleConflictResolver.UNIVERSAL_PROMPT_SUFFIX);
        assertThat(composed.negativePrompt()).startsWith("Text, blurry, red hat, words, letters");
        assertThat(composed.negativePrompt().split(", ")).doesNotHaveDuplicates();
        assertThat(composed.recommendedProvider()).isNull();
        assertThat(composed.generationParams().isEmpty()).isTrue();
    }

    @Test
    void sceneAlreadyForbiddingTextSkipsUniversalSuffix() {
        ComposedStyle composed = resolver.compose(List.of(), null, "a bridge, no text", null, null, 700);

        assertThat(composed.positivePrompt()).isEqualTo("a bridge, no text");
    }

    @Test
    void clampKeepsMarkerAtTheEnd() {
        ComposedStyle composed = resolver.compose(List.of("cartoon"), "", "x".repeat(900), null, "COMPARE", 120);

        assertThat(composed.positivePrompt()).hasSizeLessThanOrEqualTo(120).endsWith(" COMPARE");
    }

    @Test
    void clampLeavesShortPromptsAlone() {
        assertThat(StyleConflictResolver.clamp("short", 10, "M")).isEqualTo("short");
        assertThat(StyleConflictResolver.clamp("abcdefghij COMPARE", 12, "COMPARE")).isEqualTo("abcd COMPARE");
    }

    @Test
    void unknownPackIdIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.compose(List.of("vaporwave"), "", "scene", null, null, 700));
    }
}
