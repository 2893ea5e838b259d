package com.example.thumbgen_backend.dto;

import jakarta.validation.constraints.NotBlank;

public record OwnerRequest(@NotBlank String ownerExternalSubject) {
}
