package com.example.thumbgen_backend.dto;

import com.example.thumbgen_backend.model.IdentityModel;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Identity status. The trigger word is only exposed once the model is ready.
 */
public record IdentityStatusResponse(
        UUID identityModelId,
        String status,
        String triggerWord,
        String errorMessage,
        long photoCount,
        Instant trainingStartedAt,
        Instant trainingCompletedAt
) {
    public static IdentityStatusResponse none(long photoCount) {
        return new IdentityStatusResponse(null, "none", null, null, photoCount, null, null);
    }

    public static IdentityStatusResponse from(IdentityModel m, long photoCount) {
        String status = m.getStatus().name().toLowerCase(Locale.ROOT);
        boolean ready = "ready".equals(status);
        return new IdentityStatusResponse(
                m.getId(),
                status,
                ready ? m.getTriggerWord() : null,
                m.getErrorMessage(),
                photoCount,
                m.getTrainingStartedAt(),
                m.getTrainingCompletedAt()
        );
    }
}
