package com.example.thumbgen_backend.model;

/**
 * Descriptor of one generated image, stored inside JSON columns.
 */
public record OutputImage(String url, int width, int height, String contentType) {
}
