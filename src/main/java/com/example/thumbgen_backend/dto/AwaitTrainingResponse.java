package com.example.thumbgen_backend.dto;

public record AwaitTrainingResponse(String outcome, int attempts, IdentityStatusResponse identity) {
}
