package com.example.thumbgen_backend.util;

/**
 * Training lifecycle of a per-user identity model.
 * none -> pending -> training -> {ready|failed|canceled}; ready/failed/canceled -> none on reset.
 */
public enum IdentityStatus {
    NONE,
    PENDING,
    TRAINING,
    READY,
    FAILED,
    CANCELED;

    public boolean isInFlight() {
        return this == PENDING || this == TRAINING;
    }

    public boolean canCommit() {
        return this == NONE || this == FAILED || this == CANCELED;
    }
}
