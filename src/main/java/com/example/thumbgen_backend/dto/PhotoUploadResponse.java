package com.example.thumbgen_backend.dto;

import java.util.List;
import java.util.UUID;

/**
 * Per-file upload outcome plus counts. {@code photoCount} is the owner's total after this request.
 */
public record PhotoUploadResponse(
        int total,
        int uploaded,
        int failed,
        long photoCount,
        int minRequiredToTrain,
        int maxAllowed,
        List<Result> results
) {
    /** {@code url} points at the stored original and is absent for failures. */
    public record Result(String filename, String status, UUID photoId, String url, String error) {
        public static Result uploaded(String filename, UUID id, String url) {
            return new Result(filename, "uploaded", id, url, null);
        }

        public static Result duplicate(String filename, UUID id, String url) {
            return new Result(filename, "duplicate", id, url, null);
        }

        public static Result failed(String filename, String error) {
            return new Result(filename, "failed", null, null, error);
        }

        public boolean isFailed() {
            return "failed".equals(status);
        }
    }
}
