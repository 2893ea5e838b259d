package com.example.thumbgen_backend.prompt;

import com.example.thumbgen_backend.config.LlmProperties;
import com.example.thumbgen_backend.config.ThumbnailProperties;
import com.example.thumbgen_backend.engine.Interfaces.LlmCompletionEngine;
import com.example.thumbgen_backend.exception.ErrorKind;
import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.style.StyleConflictResolver;
import com.example.thumbgen_backend.style.StylePackRegistry;
import com.example.thumbgen_backend.util.ThumbnailStyle;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PromptComposer} covering the LLM plan path and the deterministic fallback.
 */
class PromptComposerTest {
    private LlmCompletionEngine llm;
    private LlmProperties llmProperties;
    private ThumbnailProperties thumbnailProperties;
    private PromptComposer composer;

    @BeforeEach
    void setup() {
        llm = Mockito.mock(LlmCompletionEngine.class);
        llmProperties = new LlmProperties();
        thumbnailProperties = new ThumbnailProperties();
        composer = new PromptComposer(llm, llmProperties, thumbnailProperties,
                new StyleConflictResolver(new StylePackRegistry()), new ObjectMapper(),
                Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Test
    void bypassUsesFallbackWithoutCallingLlm() throws Exception {
        llmProperties.setBypass(true);

        PromptPlan plan = composer.compose(request(ThumbnailStyle.SUBJECT, "guy shocked by his electricity bill", 3));

        assertThat(plan.fallback()).isTrue();
        assertThat(plan.variants()).extracting(PromptVariant::variationNote)
                .containsExactly("Tight close-up", "Medium shot with prop", "More negative space");
        assertThat(plan.variants().get(0).finalPrompt())
                .startsWith("SUBJSTYLE YouTube thumbnail")
                .contains("guy shocked by his electricity bill");
        verify(llm, never()).complete(any());
    }

    @Test
    void validLlmPlanIsUsed() throws Exception {
        when(llm.complete(any())).thenReturn("""
                {"variants":[
                  {"variationNote":"close","scene":"man staring at bill","composition":"tight","lighting":"hard",
                   "background":"plain blue","camera":"35mm","props":"paper bill","avoid":["clutter"]},
                  {"variationNote":"wide","scene":"man holding bill","composition":"medium","lighting":"soft",
                   "background":"plain orange","camera":"50mm","props":"paper bill"}
                ]}""");

        PromptPlan plan = composer.compose(request(ThumbnailStyle.OBJECT, "electricity bill shock", 2));

        assertThat(plan.fallback()).isFalse();
        assertThat(plan.variants()).extracting(PromptVariant::variationNote).containsExactly("close", "wide");
        assertThat(plan.variants().get(0).finalPrompt()).contains("scene: man staring at bill");
        assertThat(plan.variants().get(0).negativePrompt()).contains("clutter");
    }

    @Test
    void controlCharactersInLlmFieldsAreStripped() throws Exception {
        when(llm.complete(any())).thenReturn("""
                {"variants":[
                  {"variationNote":"close\\tup","scene":"man\\nstaring at\\u0007bill","composition":"tight\\r",
                   "lighting":"hard","background":"plain\\u001bblue","camera":"35mm","props":"paper\\u0000bill"}
                ]}""");

        PromptPlan plan = composer.compose(request(ThumbnailStyle.OBJECT, "electricity bill shock", 1));

        assertThat(plan.fallback()).isFalse();
        PromptVariant variant = plan.variants().get(0);
        assertThat(variant.variationNote()).isEqualTo("close up");
        assertThat(variant.finalPrompt())
                .contains("scene: man staring at bill", "background: plain blue", "props: paper bill")
                .doesNotContainPattern("[\\u0000-\\u001F\\u007F]");
    }

    @Test
    void llmFieldThatIsOnlyControlCharactersFallsBack() throws Exception {
        when(llm.complete(any())).thenReturn("""
                {"variants":[{"variationNote":"one","scene":"\\n\\t","composition":"c","lighting":"l",
                  "background":"b","camera":"c","props":"p"}]}""");

        PromptPlan plan = composer.compose(request(ThumbnailStyle.OBJECT, "rocket launch", 1));

        assertThat(plan.fallback()).isTrue();
    }

    @Test
    void malformedLlmReplyFallsBack() throws Exception {
        when(llm.complete(any())).thenReturn("sure! here are some ideas");

        PromptPlan plan = composer.compose(request(ThumbnailStyle.OBJECT, "rocket launch", 2));

        assertThat(plan.fallback()).isTrue();
        assertThat(plan.variants()).hasSize(2);
    }

    @Test
    void shortLlmPlanFallsBack() throws Exception {
        when(llm.complete(any())).thenReturn("""
                {"variants":[{"variationNote":"one","scene":"s","composition":"c","lighting":"l",
                  "background":"b","camera":"c","props":"p"}]}""");

        PromptPlan plan = composer.compose(request(ThumbnailStyle.OBJECT, "rocket launch", 3));

        assertThat(plan.fallback()).isTrue();
        assertThat(plan.variants()).hasSize(3);
    }

    @Test
    void llmFailureFallsBack() throws Exception {
        when(llm.complete(any())).thenThrow(new IllegalStateException("timeout"));

        PromptPlan plan = composer.compose(request(ThumbnailStyle.HOLD, "holding a trophy", 1));

        assertThat(plan.fallback()).isTrue();
    }

    @Test
    void compareStyleEndsWithMarkerWithinBudget() {
        llmProperties.setBypass(true);

        PromptPlan plan = composer.compose(request(ThumbnailStyle.COMPARE, "iphone vs android ".repeat(30), 4));

        assertThat(plan.variants()).hasSize(4).allSatisfy(v -> assertThat(v.finalPrompt())
                .endsWith(PromptComposer.COMPARE_MARKER)
                .hasSizeLessThanOrEqualTo(thumbnailProperties.getMaxPromptChars()));
    }

    @Test
    void identityTriggerIsRepeatedInLead() {
        llmProperties.setBypass(true);
        PromptRequest req = new PromptRequest(ThumbnailStyle.SUBJECT, "SUBJSTYLE", "TOKabc12",
                "celebrating a win", 1, List.of(), false);

        PromptPlan plan = composer.compose(req);

        assertThat(plan.variants().get(0).finalPrompt())
                .startsWith("SUBJSTYLE TOKabc12 YouTube thumbnail")
                .contains("same person as TOKabc12");
    }

    @Test
    void negativePromptParameterOnlyWhenModelAcceptsIt() {
        llmProperties.setBypass(true);
        PromptRequest with = new PromptRequest(ThumbnailStyle.OBJECT, "OBJSTYLE", null, "a red car", 1, List.of(), true);
        PromptRequest without = new PromptRequest(ThumbnailStyle.OBJECT, "OBJSTYLE", null, "a red car", 1, List.of(), false);

        assertThat(composer.compose(with).variants().get(0).providerParameters()).containsKey("negative_prompt");
        assertThat(composer.compose(without).variants().get(0).providerParameters())
                .doesNotContainKey("negative_prompt")
                .containsEntry("width", 1280)
                .containsEntry("height", 720);
    }

    @Test
    void stylePacksFlowIntoPlan() {
        llmProperties.setBypass(true);
        PromptRequest req = new PromptRequest(ThumbnailStyle.OBJECT, "OBJSTYLE", null, "a red car", 1,
                List.of("deepFried", "photoreal"), false);

        PromptPlan plan = composer.compose(req);

        assertThat(plan.keptPackIds()).containsExactly("deepFried");
        assertThat(plan.removedPackIds()).containsExactly("photorealistic");
        assertThat(plan.postProcessing()).isNotEmpty();
    }

    @Test
    void variantCountOutOfRangeIsRejected() {
        ThumbnailException ex = assertThrows(ThumbnailException.class,
                () -> composer.compose(request(ThumbnailStyle.OBJECT, "a red car", 5)));

        assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(ex.getReason()).isEqualTo("INVALID_VARIANT_COUNT");
    }

    @Test
    void blankTextIsRejected() {
        ThumbnailException ex = assertThrows(ThumbnailException.class,
                () -> composer.compose(request(ThumbnailStyle.OBJECT, " \n\t ", 1)));

        assertThat(ex.getReason()).isEqualTo("EMPTY_PROMPT");
    }

    @Test
    void sanitizeStripsControlCharactersAndTruncates() {
        assertThat(PromptComposer.sanitize("a\u0000b\nc", 100)).isEqualTo("a b c");
        assertThat(PromptComposer.sanitize("abcdef", 3)).isEqualTo("abc");
        assertThat(PromptComposer.sanitize(null, 3)).isEmpty();
    }

    private static PromptRequest request(ThumbnailStyle style, String text, int count) {
        String trigger = switch (style) {
            case COMPARE -> "CMPSTYLE";
            case SUBJECT -> "SUBJSTYLE";
            case OBJECT -> "OBJSTYLE";
            case HOLD -> "HOLDSTYLE";
        };
        return new PromptRequest(style, trigger, null, text, count, List.of(), false);
    }
}
