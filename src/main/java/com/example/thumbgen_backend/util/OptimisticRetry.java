package com.example.thumbgen_backend.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;

import java.util.function.Supplier;

/**
 * Re-runs a transactional write when a concurrent writer bumped the row version first.
 * Each attempt must open its own transaction, so callers pass a call into a transactional bean.
 */
public final class OptimisticRetry {
    private static final Logger LOGGER = LoggerFactory.getLogger(OptimisticRetry.class);

    private OptimisticRetry() {
    }

    public static <T> T run(String operation, int maxAttempts, Supplier<T> action) {
        RetryTemplate template = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .retryOn(OptimisticLockingFailureException.class)
                .noBackoff()
                .build();
        return template.execute(context -> {
            if (context.getRetryCount() > 0) {
                LOGGER.info("{} optimistic-lock conflict attempt={} retrying", operation, context.getRetryCount());
            }
            return action.get();
        });
    }
}
