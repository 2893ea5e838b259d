package com.example.thumbgen_backend.engine.Interfaces;

import java.util.List;

/**
 * Chat completion returning the raw assistant content.
 */
public interface LlmCompletionEngine {

    String complete(Request request) throws Exception;

    record Message(String role, String content) {
        public static Message system(String content) {
            return new Message("system", content);
        }

        public static Message user(String content) {
            return new Message("user", content);
        }
    }

    record Request(List<Message> messages, double temperature, int maxTokens) {}
}
