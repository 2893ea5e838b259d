package com.example.thumbgen_backend.dto;

import com.example.thumbgen_backend.model.OutputImage;
import com.example.thumbgen_backend.model.ThumbnailJob;
import com.example.thumbgen_backend.model.ThumbnailPrediction;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

public record ThumbnailJobResponse(
        UUID jobId,
        String status,
        String style,
        String source,
        UUID parentJobId,
        String userPrompt,
        List<OutputImage> outputImages,
        List<PredictionView> predictions,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt
) {
    public record PredictionView(UUID id, int sequence, String status, String variationNote, String errorMessage) {
        static PredictionView from(ThumbnailPrediction p) {
            return new PredictionView(p.getId(), p.getSequence(), lower(p.getStatus().name()),
                    p.getVariationNote(), p.getErrorMessage());
        }
    }

    public static ThumbnailJobResponse from(ThumbnailJob job, List<ThumbnailPrediction> predictions) {
        return new ThumbnailJobResponse(
                job.getId(),
                lower(job.getStatus().name()),
                job.getStyle().key(),
                lower(job.getSource().name()),
                job.getParentJobId(),
                job.getUserPrompt(),
                List.copyOf(job.getOutputImages()),
                predictions.stream().map(PredictionView::from).toList(),
                job.getErrorMessage(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getCompletedAt()
        );
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
