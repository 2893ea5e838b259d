package com.example.thumbgen_backend.prompt;

import com.example.thumbgen_backend.config.LlmProperties;
import com.example.thumbgen_backend.config.ThumbnailProperties;
import com.example.thumbgen_backend.engine.Interfaces.LlmCompletionEngine;
import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.style.ComposedStyle;
import com.example.thumbgen_backend.style.GenerationParams;
import com.example.thumbgen_backend.style.StyleConflictResolver;
import com.example.thumbgen_backend.util.ThumbnailStyle;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns free text plus trigger words into per-variant provider prompts. The LLM only proposes scene
 * descriptions; any failure to get a valid plan falls back to {@link FallbackVariants} without surfacing an error.
 */
@Component
public class PromptComposer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PromptComposer.class);

    public static final String COMPARE_MARKER = "COMPARE";

    static final String BASE_NEGATIVE =
            "text, words, letters, watermark, logo, signature, extra fingers, deformed hands, blurry, low-res, jpeg artifacts";

    static final String MUST_NO_TEXT =
            "absolutely no text, no words, no letters, no numbers, no writing, no watermark, no logos, "
                    + "no brand names, no signage, clean image without any typography";

    private static final int MAX_AVOID_TERMS = 12;

    private static final String SYSTEM_PROMPT = """
            You are a prompt transformer for image generation.

            Return ONLY valid JSON matching this exact schema:
            {
              "variants": [
                {
                  "variationNote": "short note describing the variation",
                  "scene": "what is happening (no text described)",
                  "composition": "tight close-up / medium shot with prop / negative space guidance",
                  "lighting": "lighting description",
                  "background": "background description (clean, simple)",
                  "camera": "lens/angle guidance",
                  "props": "key props",
                  "avoid": ["things to avoid"]
                }
              ]
            }

            Rules:
            - Do NOT include any trigger words; the server will add them.
            - Absolutely never ask for text/letters/logos/signage in the image.
            - Prefer simple, high-contrast, YouTube-thumbnail composition.
            - Keep fields concise.""";

    private final LlmCompletionEngine llm;
    private final LlmProperties llmProperties;
    private final ThumbnailProperties thumbnailProperties;
    private final StyleConflictResolver resolver;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public PromptComposer(LlmCompletionEngine llm,
                          LlmProperties llmProperties,
                          ThumbnailProperties thumbnailProperties,
                          StyleConflictResolver resolver,
                          ObjectMapper objectMapper,
                          Validator validator) {
        this.llm = llm;
        this.llmProperties = llmProperties;
        this.thumbnailProperties = thumbnailProperties;
        this.resolver = resolver;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public PromptPlan compose(PromptRequest request) {
        int count = request.variantCount();
        if (count < thumbnailProperties.getMinVariants() || count > thumbnailProperties.getMaxVariants()) {
            throw ThumbnailException.invalid("INVALID_VARIANT_COUNT");
        }
        String userText = sanitize(request.userText(), thumbnailProperties.getMaxUserTextChars());
        if (userText.isEmpty()) {
            throw ThumbnailException.invalid("EMPTY_PROMPT");
        }

        List<LlmVariantPlan.Variant> planned;
        boolean fallback = false;
        try {
            planned = requestPlan(userText, count);
        } catch (Exception e) {
            LOGGER.warn("PROMPT llm plan unavailable, using fallback variants style={} count={} reason={}",
                    request.style().key(), count, e.getMessage());
            planned = FallbackVariants.build(userText, count);
            fallback = true;
        }

        String lead = lead(request.styleTriggerWord(), request.identityTriggerWord());
        String marker = request.style() == ThumbnailStyle.COMPARE ? COMPARE_MARKER : null;
        int maxChars = thumbnailProperties.getMaxPromptChars();

        List<PromptVariant> variants = new ArrayList<>(count);
        ComposedStyle first = null;
        for (LlmVariantPlan.Variant v : planned.subList(0, count)) {
            ComposedStyle composed = resolver.compose(
                    request.stylePackIds(), lead, body(v), baseNegative(v.avoid()), marker, maxChars);
            if (first == null) {
                first = composed;
            }
            Map<String, Object> params = providerParameters(composed, request.acceptsNegativePrompt());
            variants.add(new PromptVariant(composed.positivePrompt(), composed.negativePrompt(), params, v.variationNote()));
        }

        LOGGER.info("PROMPT composed style={} variants={} fallback={} keptPacks={} removedPacks={} preview={}",
                request.style().key(), variants.size(), fallback, first.keptPackIds(), first.removedPackIds(),
                abbreviate(variants.get(0).finalPrompt(), 100));

        return new PromptPlan(variants, fallback, first.keptPackIds(), first.removedPackIds(),
                first.postProcessingSteps(), first.recommendedProvider());
    }

    /**
     * Asks the LLM for {@code count} variants and validates the reply strictly; throws on any deviation.
     */
    List<LlmVariantPlan.Variant> requestPlan(String userText, int count) throws Exception {
        if (llmProperties.isBypass()) {
            throw new IllegalStateException("llm bypass enabled");
        }
        String content = llm.complete(new LlmCompletionEngine.Request(
                List.of(LlmCompletionEngine.Message.system(SYSTEM_PROMPT),
                        LlmCompletionEngine.Message.user(userPrompt(userText, count))),
                llmProperties.getTemperature(),
                llmProperties.getMaxTokens()));
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("empty llm response");
        }

        LlmVariantPlan plan = sanitized(objectMapper.readValue(content.trim(), LlmVariantPlan.class));
        Set<ConstraintViolation<LlmVariantPlan>> violations = validator.validate(plan);
        if (!violations.isEmpty()) {
            String summary = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new IllegalStateException("llm plan failed validation: " + summary);
        }
        if (plan.variants().size() < count) {
            throw new IllegalStateException("llm returned " + plan.variants().size() + " of " + count + " variants");
        }
        return plan.variants();
    }

    /** Strips control characters from every model-written field before validation sees it. */
    static LlmVariantPlan sanitized(LlmVariantPlan plan) {
        if (plan == null || plan.variants() == null) {
            return plan;
        }
        List<LlmVariantPlan.Variant> cleaned = new ArrayList<>(plan.variants().size());
        for (LlmVariantPlan.Variant v : plan.variants()) {
            if (v == null) {
                cleaned.add(null);
                continue;
            }
            cleaned.add(new LlmVariantPlan.Variant(
                    clean(v.variationNote()),
                    clean(v.scene()),
                    clean(v.composition()),
                    clean(v.lighting()),
                    clean(v.background()),
                    clean(v.camera()),
                    clean(v.props()),
                    v.avoid().stream().map(PromptComposer::clean).collect(Collectors.toList())));
        }
        return new LlmVariantPlan(cleaned);
    }

    private static String clean(String value) {
        return value == null ? null : stripControlChars(value).trim();
    }

    static String userPrompt(String userText, int count) {
        StringBuilder sb = new StringBuilder()
                .append("User intent: ").append(userText).append("\n\n")
                .append("Generate exactly ").append(count).append(" variants:\n")
                .append("- v1: tight close-up\n")
                .append("- v2: medium shot with prop\n")
                .append("- v3: more negative space for later text overlay\n");
        if (count >= 4) {
            sb.append("- v4: dramatic angle / dynamic motion\n");
        }
        return sb.append("\nReturn JSON only.").toString();
    }

    static String lead(String styleTrigger, String identityTrigger) {
        String style = styleTrigger == null ? "" : styleTrigger.trim();
        String identity = identityTrigger == null ? "" : identityTrigger.trim();
        if (!identity.isEmpty()) {
            return style + " " + identity + " YouTube thumbnail, 16:9, 1280x720, professional photo, correct human anatomy, "
                    + "natural proportions, " + identity + " person, portrait of " + identity + ", " + identity + " face, "
                    + "highly detailed face, facial features of " + identity + ", same person as " + identity + ",";
        }
        return style + " YouTube thumbnail, 16:9, 1280x720, professional photo, correct human anatomy, natural proportions,";
    }

    static String body(LlmVariantPlan.Variant v) {
        return String.join(", ",
                "scene: " + v.scene(),
                "composition: " + v.composition(),
                "lighting: " + v.lighting(),
                "background: " + v.background(),
                "camera: " + v.camera(),
                "props: " + v.props(),
                MUST_NO_TEXT
        ).replaceAll("\\s+", " ").trim();
    }

    static String baseNegative(List<String> avoid) {
        String extra = avoid.stream()
                .map(term -> stripControlChars(term).trim())
                .filter(term -> !term.isEmpty())
                .limit(MAX_AVOID_TERMS)
                .collect(Collectors.joining(", "));
        return extra.isEmpty() ? BASE_NEGATIVE : BASE_NEGATIVE + ", " + extra;
    }

    private Map<String, Object> providerParameters(ComposedStyle composed, boolean acceptsNegativePrompt) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("prompt", composed.positivePrompt());
        params.put("width", thumbnailProperties.getOutputWidth());
        params.put("height", thumbnailProperties.getOutputHeight());
        params.put("num_outputs", 1);
        params.put("output_format", "png");
        GenerationParams gp = composed.generationParams();
        if (gp.guidanceScale() != null) {
            params.put("guidance_scale", gp.guidanceScale());
        }
        if (gp.inferenceSteps() != null) {
            params.put("num_inference_steps", gp.inferenceSteps());
        }
        if (acceptsNegativePrompt) {
            params.put("negative_prompt", composed.negativePrompt());
        }
        return params;
    }

    /** Replaces control characters with spaces, trims and truncates. */
    public static String sanitize(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String cleaned = stripControlChars(text).trim();
        return cleaned.length() > maxChars ? cleaned.substring(0, maxChars).trim() : cleaned;
    }

    static String stripControlChars(String s) {
        return s.replaceAll("[\\u0000-\\u001F\\u007F]", " ");
    }

    public static String abbreviate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
