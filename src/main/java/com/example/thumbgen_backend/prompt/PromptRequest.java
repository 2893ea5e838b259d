package com.example.thumbgen_backend.prompt;

import com.example.thumbgen_backend.util.ThumbnailStyle;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Input of {@link PromptComposer#compose(PromptRequest)}.
 *
 * @param identityTriggerWord trigger word of a ready identity model, or null.
 * @param stylePackIds        pack ids selected from the user controls, possibly empty.
 * @param acceptsNegativePrompt whether the style model takes a {@code negative_prompt} input.
 */
public record PromptRequest(ThumbnailStyle style,
                            String styleTriggerWord,
                            @Nullable String identityTriggerWord,
                            String userText,
                            int variantCount,
                            List<String> stylePackIds,
                            boolean acceptsNegativePrompt) {

    public PromptRequest {
        stylePackIds = stylePackIds == null ? List.of() : List.copyOf(stylePackIds);
    }
}
