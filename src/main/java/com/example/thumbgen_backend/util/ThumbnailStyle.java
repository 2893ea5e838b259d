package com.example.thumbgen_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Thumbnail layouts backed by a dedicated fine-tuned style model.
 */
public enum ThumbnailStyle {
    COMPARE,
    SUBJECT,
    OBJECT,
    HOLD;

    /** Only layouts that feature a person may carry the user's identity weights. */
    public boolean supportsIdentity() {
        return this == SUBJECT || this == HOLD;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ThumbnailStyle fromKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        return ThumbnailStyle.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
