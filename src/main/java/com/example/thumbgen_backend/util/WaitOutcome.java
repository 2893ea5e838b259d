package com.example.thumbgen_backend.util;

/**
 * Result of a bounded wait for identity training.
 */
public enum WaitOutcome {
    READY,
    FAILED,
    CANCELED,
    TIMED_OUT
}
