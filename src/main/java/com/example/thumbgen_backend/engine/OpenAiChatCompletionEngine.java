package com.example.thumbgen_backend.engine;

import com.example.thumbgen_backend.config.LlmProperties;
import com.example.thumbgen_backend.engine.Interfaces.LlmCompletionEngine;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OpenAI-compatible chat completion in JSON mode.
 */
@Service
public class OpenAiChatCompletionEngine implements LlmCompletionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiChatCompletionEngine.class);

    private final WebClient client;
    private final LlmProperties props;

    public OpenAiChatCompletionEngine(@Qualifier("llmWebClient") WebClient client, LlmProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public String complete(Request request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getModel());
        body.put("messages", request.messages().stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList());
        body.put("temperature", request.temperature());
        body.put("max_tokens", request.maxTokens());
        body.put("response_format", Map.of("type", "json_object"));

        JsonNode root = client.post()
                .uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(b -> new IllegalStateException("LLM error %s: %s".formatted(resp.statusCode(), b))))
                .bodyToMono(JsonNode.class)
                .block(Duration.ofSeconds(props.getTimeoutSeconds()));

        if (root == null) throw new IllegalStateException("Empty response from LLM");
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new IllegalStateException("LLM response has no choices");
        }
        String content = choices.get(0).path("message").path("content").asText("");
        LOGGER.debug("LLM completion model={} contentLength={}", props.getModel(), content.length());
        return content;
    }
}
