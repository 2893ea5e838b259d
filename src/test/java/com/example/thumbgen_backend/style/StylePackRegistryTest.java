package com.example.thumbgen_backend.style;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StylePackRegistryTest {

    private final StylePackRegistry registry = new StylePackRegistry();

    @Test
    void defaultTableLoadsAllPacks() {
        assertThat(registry.all()).extracting(StylePack::id).contains(
                "deepFried", "rageComic", "reactionFace", "wojakLike", "surrealCursed",
                "cartoon", "anime", "comic-ink", "cinematic", "photorealistic", "vector-flat", "3d-mascot");
    }

    @Test
    void findResolvesAlias() {
        assertThat(registry.find("photoreal")).map(StylePack::id).contains("photorealistic");
        assertThat(registry.find("nope")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void requireRejectsUnknownPack() {
        assertThrows(IllegalArgumentException.class, () -> registry.require("vaporwave"));
    }

    @Test
    void memeStyleWinsOverVisualStyle() {
        assertThat(registry.packIdsFromControls("deepFried", "cinematic")).containsExactly("deepFried");
        assertThat(registry.packIdsFromControls("off", "photoreal")).containsExactly("photorealistic");
        assertThat(registry.packIdsFromControls(null, "auto")).isEmpty();
        assertThat(registry.packIdsFromControls(" ", null)).isEmpty();
    }

    @Test
    void unknownControlValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.packIdsFromControls("cinematic", null));
        assertThrows(IllegalArgumentException.class, () -> registry.packIdsFromControls(null, "watercolor"));
    }

    @Test
    void duplicateIdFailsValidation() {
        StylePack a = pack("a", Set.of());
        assertThrows(IllegalStateException.class, () -> new StylePackRegistry(List.of(a, a)));
    }

    @Test
    void selfConflictFailsValidation() {
        assertThrows(IllegalStateException.class, () -> new StylePackRegistry(List.of(pack("a", Set.of("a")))));
    }

    @Test
    void unknownConflictFailsUnlessReserved() {
        assertThrows(IllegalStateException.class, () -> new StylePackRegistry(List.of(pack("a", Set.of("ghost")))));

        StylePackRegistry reserved = new StylePackRegistry(List.of(pack("a", Set.of("minimal", "clean"))));
        assertThat(reserved.find("a")).isPresent();
    }

    @Test
    void outOfRangeIntensityFailsValidation() {
        StylePack bad = new StylePack("a", "A", "prefix, ", "", "", GenerationParams.NONE,
                List.of(PostProcessingStep.of(PostProcessingType.SHARPEN, 101)), StylePack.ANY_PROVIDER, 1, true, Set.of());
        assertThrows(IllegalStateException.class, () -> new StylePackRegistry(List.of(bad)));
    }

    static StylePack pack(String id, Set<String> conflicts) {
        return new StylePack(id, id, id + " prefix, ", "", "", GenerationParams.NONE,
                List.of(), StylePack.ANY_PROVIDER, 10, false, conflicts);
    }
}
