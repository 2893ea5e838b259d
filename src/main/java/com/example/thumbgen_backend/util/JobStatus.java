package com.example.thumbgen_backend.util;

/**
 * Lifecycle of a thumbnail job. Terminal values are frozen once reached.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }
}
