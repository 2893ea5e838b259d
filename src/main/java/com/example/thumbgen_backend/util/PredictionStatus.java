package com.example.thumbgen_backend.util;

import java.util.Locale;

/**
 * Status of a single provider prediction, mirroring the provider's own vocabulary.
 */
public enum PredictionStatus {
    STARTING,
    PROCESSING,
    SUCCEEDED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }

    /**
     * Parses the provider's lowercase status string.
     *
     * @param raw provider status, e.g. {@code "processing"}.
     * @return matching status.
     * @throws IllegalArgumentException when blank or unknown.
     */
    public static PredictionStatus fromProvider(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("prediction status is blank");
        }
        return PredictionStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
