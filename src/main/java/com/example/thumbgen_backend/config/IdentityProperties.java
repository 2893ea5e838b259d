package com.example.thumbgen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "identity")
public class IdentityProperties {

    private int minPhotos = 7;
    private int maxPhotosPerUser = 30;
    private int maxFilesPerRequest = 20;
    private long maxBytes = 10L * 1024 * 1024;
    private int minDimension = 256;
    private List<String> allowedContentTypes = List.of("image/jpeg", "image/png", "image/webp");
    private double identityLoraScale = 1.6;
    private double styleLoraScale = 0.5;
    private String trainerDataKey = "input_images";
    private String trainerTriggerKey = "trigger_word";
    private Map<String, Object> trainerInput = defaultTrainerInput();
    private Wait wait = new Wait();
    private Duration pendingTimeout = Duration.ofMinutes(15);
    private Duration trainingTimeout = Duration.ofHours(3);
    private int sweeperBatchSize = 20;

    private static Map<String, Object> defaultTrainerInput() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("lora_type", "subject");
        input.put("steps", 2500);
        input.put("learning_rate", 0.0004);
        input.put("lora_rank", 32);
        input.put("resolution", "1024");
        input.put("autocaption", true);
        return input;
    }

    public int getMinPhotos() {
        return minPhotos;
    }

    public void setMinPhotos(int minPhotos) {
        this.minPhotos = minPhotos;
    }

    public int getMaxPhotosPerUser() {
        return maxPhotosPerUser;
    }

    public void setMaxPhotosPerUser(int maxPhotosPerUser) {
        this.maxPhotosPerUser = maxPhotosPerUser;
    }

    public int getMaxFilesPerRequest() {
        return maxFilesPerRequest;
    }

    public void setMaxFilesPerRequest(int maxFilesPerRequest) {
        this.maxFilesPerRequest = maxFilesPerRequest;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public void setMaxBytes(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    public int getMinDimension() {
        return minDimension;
    }

    public void setMinDimension(int minDimension) {
        this.minDimension = minDimension;
    }

    public List<String> getAllowedContentTypes() {
        return allowedContentTypes;
    }

    public void setAllowedContentTypes(List<String> allowedContentTypes) {
        this.allowedContentTypes = allowedContentTypes;
    }

    public double getIdentityLoraScale() {
        return identityLoraScale;
    }

    public void setIdentityLoraScale(double identityLoraScale) {
        this.identityLoraScale = identityLoraScale;
    }

    public double getStyleLoraScale() {
        return styleLoraScale;
    }

    public void setStyleLoraScale(double styleLoraScale) {
        this.styleLoraScale = styleLoraScale;
    }

    public String getTrainerDataKey() {
        return trainerDataKey;
    }

    public void setTrainerDataKey(String trainerDataKey) {
        this.trainerDataKey = trainerDataKey;
    }

    public String getTrainerTriggerKey() {
        return trainerTriggerKey;
    }

    public void setTrainerTriggerKey(String trainerTriggerKey) {
        this.trainerTriggerKey = trainerTriggerKey;
    }

    public Map<String, Object> getTrainerInput() {
        return trainerInput;
    }

    public void setTrainerInput(Map<String, Object> trainerInput) {
        this.trainerInput = trainerInput;
    }

    public Wait getWait() {
        return wait;
    }

    public void setWait(Wait wait) {
        this.wait = wait;
    }

    /** A committed model that has not reached the provider after this long is failed. */
    public Duration getPendingTimeout() {
        return pendingTimeout;
    }

    public void setPendingTimeout(Duration pendingTimeout) {
        this.pendingTimeout = pendingTimeout;
    }

    public Duration getTrainingTimeout() {
        return trainingTimeout;
    }

    public void setTrainingTimeout(Duration trainingTimeout) {
        this.trainingTimeout = trainingTimeout;
    }

    public int getSweeperBatchSize() {
        return sweeperBatchSize;
    }

    public void setSweeperBatchSize(int sweeperBatchSize) {
        this.sweeperBatchSize = sweeperBatchSize;
    }

    /**
     * Bounds of the training wait loop. Each attempt holds a request thread, so keep the product small.
     */
    public static class Wait {
        private int maxAttempts = 24;
        private Duration interval = Duration.ofSeconds(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }
}
