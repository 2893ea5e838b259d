package com.example.thumbgen_backend.prompt;

import java.util.Map;

public record PromptVariant(String finalPrompt,
                            String negativePrompt,
                            Map<String, Object> providerParameters,
                            String variationNote) {

    public PromptVariant {
        providerParameters = Map.copyOf(providerParameters);
    }
}
