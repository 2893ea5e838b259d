package com.example.thumbgen_backend.engine.Interfaces;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Asynchronous image-generation provider: predictions, trainings, model management and file uploads.
 * Implementations throw {@link com.example.thumbgen_backend.exception.ProviderException} on failure.
 */
public interface ImageGenerationProvider {

    Prediction createPrediction(PredictionRequest request);

    Prediction getPrediction(String predictionId);

    /**
     * Checks that the exact model version is still served. Never throws for provider errors.
     */
    VersionCheck verifyModelVersion(String owner, String name, String version);

    Training createTraining(TrainingRequest request);

    Training getTraining(String trainingId);

    UploadedFile uploadFile(String filename, String contentType, byte[] bytes);

    void createModel(String owner, String name, String description);

    void deleteModel(String owner, String name);

    record PredictionRequest(String version, Map<String, Object> input, String webhookUrl) {}

    /**
     * @param status raw provider status, e.g. {@code "processing"}.
     * @param output provider output, usually a URL or an array of URLs; may be null.
     */
    record Prediction(String id, String status, JsonNode output, String error) {}

    /**
     * @param trainerVersion {@code owner/model:version} of the trainer.
     * @param destination    {@code owner/name} of the model receiving the weights.
     */
    record TrainingRequest(String trainerVersion, String destination, Map<String, Object> input, String webhookUrl) {}

    record Training(String id, String status, JsonNode output, String error) {}

    record UploadedFile(String id, String url) {}

    record VersionCheck(boolean valid, String error) {
        public static VersionCheck ok() {
            return new VersionCheck(true, null);
        }

        public static VersionCheck invalid(String error) {
            return new VersionCheck(false, error);
        }
    }
}
