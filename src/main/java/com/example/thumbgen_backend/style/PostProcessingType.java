package com.example.thumbgen_backend.style;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PostProcessingType {
    SATURATION,
    CONTRAST,
    SHARPEN,
    BLUR,
    JPEG_ARTIFACTS,
    POSTERIZE,
    CHROMATIC_ABERRATION,
    NOISE,
    OUTLINE,
    CEL_SHADE,
    BRIGHTNESS,
    GAMMA;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
