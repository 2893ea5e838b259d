package com.example.thumbgen_backend.util;

import java.time.Duration;

/**
 * Bounds of a wait loop: at most {@code maxAttempts} checks, {@code interval} apart.
 */
public record WaitPolicy(int maxAttempts, Duration interval) {

    public WaitPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be >= 0");
        }
    }

    public Duration maxWait() {
        return interval.multipliedBy(maxAttempts - 1L);
    }

    /** Pause between attempts; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
