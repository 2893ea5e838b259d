package com.example.thumbgen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "replicate")
public class ReplicateProperties {

    private String baseUrl = "https://api.replicate.com/v1";
    private String apiToken;
    private int connectTimeoutMillis = 10_000;
    private long responseTimeoutSeconds = 60;
    private long blockTimeoutSeconds = 90;
    private String webhookSecret;
    private long webhookToleranceSeconds = 300;
    private String modelOwner;
    /** {@code owner/model:version} of the identity trainer. */
    private String trainerVersion;

    public boolean hasToken() {
        return apiToken != null && !apiToken.isBlank();
    }

    public boolean hasWebhookSecret() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public long getResponseTimeoutSeconds() {
        return responseTimeoutSeconds;
    }

    public void setResponseTimeoutSeconds(long responseTimeoutSeconds) {
        this.responseTimeoutSeconds = responseTimeoutSeconds;
    }

    public long getBlockTimeoutSeconds() {
        return blockTimeoutSeconds;
    }

    public void setBlockTimeoutSeconds(long blockTimeoutSeconds) {
        this.blockTimeoutSeconds = blockTimeoutSeconds;
    }

    public String getWebhookSecret() {
        return webhookSecret;
    }

    public void setWebhookSecret(String webhookSecret) {
        this.webhookSecret = webhookSecret;
    }

    public long getWebhookToleranceSeconds() {
        return webhookToleranceSeconds;
    }

    public void setWebhookToleranceSeconds(long webhookToleranceSeconds) {
        this.webhookToleranceSeconds = webhookToleranceSeconds;
    }

    public String getModelOwner() {
        return modelOwner;
    }

    public void setModelOwner(String modelOwner) {
        this.modelOwner = modelOwner;
    }

    public String getTrainerVersion() {
        return trainerVersion;
    }

    public void setTrainerVersion(String trainerVersion) {
        this.trainerVersion = trainerVersion;
    }
}
