package com.example.thumbgen_backend.style;

import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.example.thumbgen_backend.style.PostProcessingType.*;

/**
 * Closed table of style packs, validated once when the registry is created.
 */
@Component
public class StylePackRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(StylePackRegistry.class);

    public static final String MEME_STYLE_OFF = "off";
    public static final String VISUAL_STYLE_AUTO = "auto";

    private static final Map<String, String> VISUAL_STYLE_TO_PACK = Map.of(
            "photoreal", "photorealistic",
            "cinematic", "cinematic",
            "cartoon", "cartoon",
            "anime", "anime",
            "3d-mascot", "3d-mascot",
            "vector-flat", "vector-flat",
            "comic-ink", "comic-ink"
    );

    private static final Map<String, String> ALIASES = Map.of("photoreal", "photorealistic");

    private static final Set<String> MEME_PACKS = Set.of("deepFried", "rageComic", "reactionFace", "wojakLike", "surrealCursed");

    private final Map<String, StylePack> packs;

    public StylePackRegistry() {
        this(defaultPacks());
    }

    StylePackRegistry(List<StylePack> definitions) {
        Map<String, StylePack> byId = new LinkedHashMap<>();
        for (StylePack pack : definitions) {
            if (byId.put(pack.id(), pack) != null) {
                throw new IllegalStateException("Duplicate style pack id: " + pack.id());
            }
        }
        validate(byId);
        this.packs = Collections.unmodifiableMap(byId);
        LOGGER.info("StylePackRegistry loaded packs={}", packs.keySet());
    }

    public Optional<StylePack> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String key = ALIASES.getOrDefault(id, id);
        return Optional.ofNullable(packs.get(key));
    }

    public StylePack require(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("Unknown style pack: " + id));
    }

    public Collection<StylePack> all() {
        return packs.values();
    }

    public boolean isMemeStyle(String value) {
        return value != null && MEME_PACKS.contains(value);
    }

    public boolean isVisualStyle(String value) {
        return value != null && VISUAL_STYLE_TO_PACK.containsKey(value);
    }

    /**
     * Maps the two user controls onto pack ids. A selected meme style takes precedence:
     * the visual style only contributes a pack when no meme pack was chosen.
     *
     * @param memeStyle   meme control value, {@code "off"} or null for none.
     * @param visualStyle visual control value, {@code "auto"} or null for none.
     * @return zero, one pack id; never both controls.
     */
    public List<String> packIdsFromControls(@Nullable String memeStyle, @Nullable String visualStyle) {
        List<String> ids = new ArrayList<>(1);
        if (memeStyle != null && !memeStyle.isBlank() && !MEME_STYLE_OFF.equals(memeStyle)) {
            if (!isMemeStyle(memeStyle)) {
                throw new IllegalArgumentException("Unknown meme style: " + memeStyle);
            }
            ids.add(memeStyle);
        }
        if (ids.isEmpty() && visualStyle != null && !visualStyle.isBlank() && !VISUAL_STYLE_AUTO.equals(visualStyle)) {
            String packId = VISUAL_STYLE_TO_PACK.get(visualStyle);
            if (packId == null) {
                throw new IllegalArgumentException("Unknown visual style: " + visualStyle);
            }
            ids.add(packId);
        }
        return ids;
    }

    private static void validate(Map<String, StylePack> byId) {
        for (StylePack pack : byId.values()) {
            if (pack.id() == null || pack.id().isBlank()) {
                throw new IllegalStateException("Style pack without id");
            }
            if (pack.promptPrefix() == null || pack.promptPrefix().isBlank()) {
                throw new IllegalStateException("Style pack " + pack.id() + " has no prompt prefix");
            }
            if (pack.recommendedProvider() == null || pack.recommendedProvider().isBlank()) {
                throw new IllegalStateException("Style pack " + pack.id() + " has no provider hint");
            }
            for (PostProcessingStep step : pack.postProcessing()) {
                if (step.type() == null || step.intensity() < 0 || step.intensity() > 100) {
                    throw new IllegalStateException("Style pack " + pack.id() + " has invalid post-processing step " + step);
                }
            }
            for (String conflict : pack.conflictsWith()) {
                if (conflict.equals(pack.id())) {
                    throw new IllegalStateException("Style pack " + pack.id() + " conflicts with itself");
                }
                // "minimal" and "clean" are reserved ids for packs that are not registered yet
                if (!byId.containsKey(conflict) && !RESERVED_CONFLICT_IDS.contains(conflict)) {
                    throw new IllegalStateException("Style pack " + pack.id() + " conflicts with unknown pack " + conflict);
                }
            }
        }
    }

    private static final Set<String> RESERVED_CONFLICT_IDS = Set.of("minimal", "clean");

    static List<StylePack> defaultPacks() {
        return List.of(
                new StylePack("deepFried", "Deep Fried",
                        "bold colors, high contrast, ",
                        ", vibrant colors",
                        "muted colors, soft",
                        GenerationParams.guidance(7),
                        List.of(PostProcessingStep.of(SATURATION, 70),
                                PostProcessingStep.of(CONTRAST, 100),
                                PostProcessingStep.of(SHARPEN, 100),
                                PostProcessingStep.of(NOISE, 50),
                                PostProcessingStep.of(JPEG_ARTIFACTS, 100),
                                PostProcessingStep.of(JPEG_ARTIFACTS, 100),
                                PostProcessingStep.of(JPEG_ARTIFACTS, 100)),
                        StylePack.ANY_PROVIDER, 100, true,
                        Set.of("photorealistic", "minimal", "clean", "cinematic")),
                new StylePack("rageComic", "Rage Comic",
                        "rage comic webcomic style, black and white line art, thick uneven ink outlines, "
                                + "simple crude shading, 2D flat drawing, exaggerated facial features, "
                                + "early 2010s internet meme aesthetic, MS Paint webcomic style, "
                                + "original character design NOT copying known meme faces, ",
                        ", rage comic art style, webcomic illustration, crude line drawing, meme aesthetic",
                        "photorealistic, 3D render, smooth gradients, realistic lighting, detailed shading, "
                                + "professional illustration, photograph, trollface, known meme face, copyrighted character",
                        GenerationParams.guidance(8),
                        List.of(PostProcessingStep.of(CONTRAST, 70), PostProcessingStep.of(POSTERIZE, 40)),
                        StylePack.ANY_PROVIDER, 85, false,
                        Set.of("photorealistic", "cinematic", "anime")),
                new StylePack("reactionFace", "Reaction Face",
                        "sticker cutout style, bold thick black outline, high saturation colors, "
                                + "exaggerated facial expression, simple flat shading, reaction meme style, "
                                + "expressive face design, clearly separated from background, ",
                        ", reaction face style, bold outline, sticker aesthetic, expressive meme",
                        "photorealistic skin texture, hyperrealistic, soft blended edges, subtle expression, "
                                + "muted colors, realistic lighting",
                        GenerationParams.guidance(7),
                        List.of(PostProcessingStep.of(SATURATION, 50),
                                PostProcessingStep.of(CONTRAST, 45),
                                PostProcessingStep.of(SHARPEN, 30)),
                        StylePack.ANY_PROVIDER, 80, false,
                        Set.of("photorealistic", "minimal")),
                new StylePack("wojakLike", "Wojak-Like",
                        "minimalistic 2D line art portrait, simple web comic style, "
                                + "muted but high-contrast palette, simple geometric shapes, "
                                + "expressive emotion through minimal lines, original character design, ",
                        ", minimalist line art, simple emotional portrait, web comic aesthetic",
                        "photorealistic, detailed shading, 3D render, complex textures, realistic anatomy, "
                                + "wojak, feels guy, copyrighted meme",
                        GenerationParams.guidance(7),
                        List.of(PostProcessingStep.of(CONTRAST, 50), PostProcessingStep.of(POSTERIZE, 35)),
                        StylePack.ANY_PROVIDER, 75, false,
                        Set.of("photorealistic", "cinematic", "3d-mascot")),
                new StylePack("surrealCursed", "Surreal Cursed",
                        "surreal absurdist meme aesthetic, dreamlike impossible scene, "
                                + "unexpected object combinations, slightly unsettling but humorous, "
                                + "bold color pops, simple composition with clear subject, ",
                        ", surreal meme style, absurdist composition, dreamlike quality",
                        "body horror, grotesque, realistic, stock photo, normal everyday scene, boring composition, muted colors",
                        GenerationParams.guidance(9),
                        List.of(PostProcessingStep.of(SATURATION, 40), PostProcessingStep.of(CONTRAST, 35)),
                        StylePack.ANY_PROVIDER, 70, false,
                        Set.of("photorealistic", "minimal", "clean")),
                new StylePack("cartoon", "Cartoon",
                        "COLORFUL CARTOON DOODLE ILLUSTRATION. "
                                + "Style reference: colorful infographic animations. "
                                + "COLOR PALETTE (MANDATORY): bright blue, orange, green, yellow. "
                                + "Characters: simple blob-like cartoon characters with solid bright color fills. "
                                + "Faces: simple dot eyes, curved smile, NO detailed features. "
                                + "Background: bold solid color or simple gradient. ",
                        ". VIBRANT COLORS MANDATORY. Colorful cartoon blob characters with solid color fills. "
                                + "Bright and playful. NEVER black and white. NEVER grayscale. NEVER pencil sketch.",
                        "black and white, grayscale, monochrome, pencil sketch, ink drawing, line art, uncolored, "
                                + "realistic, photorealistic, photograph, real person, muted colors, desaturated, dull, "
                                + "3D render, cinematic, red background, white background",
                        new GenerationParams(12.0, 50, null),
                        List.of(PostProcessingStep.of(SATURATION, 100), PostProcessingStep.of(CONTRAST, 40)),
                        "openai", 80, true,
                        Set.of("photorealistic", "cinematic")),
                new StylePack("anime", "Anime",
                        "Create an anime illustration in Japanese animation style. "
                                + "Large expressive anime eyes, dynamic anime pose, cel-shaded coloring. "
                                + "COLOR PALETTE: Use blues, oranges, greens, and yellows. Avoid heavy red backgrounds. "
                                + "This is NOT photorealistic. This is 2D anime art. ",
                        ". Draw in anime art style with cel shading and anime aesthetic. Not a photograph.",
                        "photorealistic, western cartoon, 3D render, realistic proportions, small eyes, realistic skin, "
                                + "photograph, real person, red background",
                        GenerationParams.guidance(8),
                        List.of(PostProcessingStep.of(SATURATION, 30), PostProcessingStep.of(CONTRAST, 25)),
                        "openai", 75, true,
                        Set.of("photorealistic", "cinematic", "comic-ink")),
                new StylePack("comic-ink", "Comic Ink",
                        "comic book ink art, bold black ink lines, halftone dot shading, "
                                + "classic comic book style, stark black and white contrast with color, "
                                + "graphic novel illustration, heavy ink outlines, ",
                        ", comic book art, ink drawing style, bold linework, graphic novel aesthetic",
                        "photorealistic, soft gradients, airbrush, smooth blending, realistic lighting, photograph",
                        GenerationParams.guidance(8),
                        List.of(PostProcessingStep.of(CONTRAST, 60), PostProcessingStep.of(SHARPEN, 40)),
                        StylePack.ANY_PROVIDER, 70, false,
                        Set.of("anime", "photorealistic")),
                new StylePack("cinematic", "Cinematic",
                        "cinematic film still, movie poster quality, dramatic rim lighting, "
                                + "professional cinematography, film color grading, shallow depth of field, "
                                + "anamorphic lens look, COLOR PALETTE: Use blues and oranges for cinematic contrast. ",
                        ", cinematic lighting, film grain, movie quality, dramatic composition, blue and orange color grading",
                        "cartoon, anime, flat colors, cel shading, illustration, vector art, red background",
                        new GenerationParams(6.0, null, "cinematic"),
                        List.of(PostProcessingStep.of(CONTRAST, 25), PostProcessingStep.of(SATURATION, 15)),
                        "stability", 60, false,
                        Set.of("cartoon", "anime", "deepFried")),
                new StylePack("photorealistic", "Photorealistic",
                        "ultra photorealistic, professional photography, DSLR quality, "
                                + "natural lighting, realistic skin texture, lifelike details, "
                                + "8k resolution, sharp focus, professional studio photography, ",
                        ", photorealistic render, hyperrealistic details, professional photograph, blue and orange lighting accents",
                        "cartoon, illustration, anime, cel shading, flat colors, unrealistic, CGI look, artificial, "
                                + "plastic skin, red background",
                        new GenerationParams(5.0, 60, "photographic"),
                        List.of(PostProcessingStep.of(SHARPEN, 20)),
                        "stability", 50, false,
                        Set.of("cartoon", "anime", "comic-ink", "deepFried")),
                new StylePack("vector-flat", "Vector Flat",
                        "flat vector illustration, clean geometric shapes, minimal shading, "
                                + "solid color fills, graphic design style, modern flat design, crisp edges, simplified forms, ",
                        ", vector art style, flat design, clean minimal illustration",
                        "photorealistic, gradients, 3D shading, complex textures, detailed, realistic lighting, "
                                + "photograph, busy background",
                        GenerationParams.guidance(7),
                        List.of(PostProcessingStep.of(POSTERIZE, 30), PostProcessingStep.of(CONTRAST, 30)),
                        StylePack.ANY_PROVIDER, 55, false,
                        Set.of("photorealistic", "cinematic")),
                new StylePack("3d-mascot", "3D Mascot",
                        "3D rendered character, smooth rounded surfaces, soft shadows, friendly character design, "
                                + "high quality 3D render, appealing mascot design, subsurface scattering, ",
                        ", 3D animation quality, smooth 3D surfaces",
                        "flat 2D, hand drawn, sketch, line art, realistic human, low poly, angular, harsh shadows",
                        new GenerationParams(6.0, null, "digital-art"),
                        List.of(),
                        "stability", 65, false,
                        Set.of("comic-ink", "vector-flat"))
        );
    }
}
