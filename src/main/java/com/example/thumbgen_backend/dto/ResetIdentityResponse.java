package com.example.thumbgen_backend.dto;

public record ResetIdentityResponse(String status, int deletedPhotos) {
}
