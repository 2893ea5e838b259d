package com.example.thumbgen_backend.config;

import com.example.thumbgen_backend.util.ThumbnailStyle;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Generation pipeline settings, including the per-style model table.
 */
@ConfigurationProperties(prefix = "thumbnails")
public class ThumbnailProperties {

    private String webhookBaseUrl = "http://localhost:8080";
    private int maxPromptChars = 700;
    private int maxUserTextChars = 500;
    private int minVariants = 1;
    private int maxVariants = 4;
    private int outputWidth = 1280;
    private int outputHeight = 720;
    private String outputContentType = "image/png";
    private Duration staleAfter = Duration.ofMinutes(30);
    private int sweeperBatchSize = 20;
    private long sweeperDelayMs = 60_000;
    private Map<String, StyleModel> styles = new LinkedHashMap<>();

    public StyleModel styleModel(ThumbnailStyle style) {
        StyleModel model = styles.get(style.key());
        if (model == null) {
            model = styles.get(style.name().toLowerCase(Locale.ROOT));
        }
        return model;
    }

    public String webhookUrl() {
        return webhookBase() + "/v1/webhooks/replicate";
    }

    public String trainingWebhookUrl() {
        return webhookBase() + "/v1/webhooks/replicate/training";
    }

    private String webhookBase() {
        return webhookBaseUrl.endsWith("/") ? webhookBaseUrl.substring(0, webhookBaseUrl.length() - 1) : webhookBaseUrl;
    }

    public String getWebhookBaseUrl() {
        return webhookBaseUrl;
    }

    public void setWebhookBaseUrl(String webhookBaseUrl) {
        this.webhookBaseUrl = webhookBaseUrl;
    }

    public int getMaxPromptChars() {
        return maxPromptChars;
    }

    public void setMaxPromptChars(int maxPromptChars) {
        this.maxPromptChars = maxPromptChars;
    }

    public int getMaxUserTextChars() {
        return maxUserTextChars;
    }

    public void setMaxUserTextChars(int maxUserTextChars) {
        this.maxUserTextChars = maxUserTextChars;
    }

    public int getMinVariants() {
        return minVariants;
    }

    public void setMinVariants(int minVariants) {
        this.minVariants = minVariants;
    }

    public int getMaxVariants() {
        return maxVariants;
    }

    public void setMaxVariants(int maxVariants) {
        this.maxVariants = maxVariants;
    }

    public int getOutputWidth() {
        return outputWidth;
    }

    public void setOutputWidth(int outputWidth) {
        this.outputWidth = outputWidth;
    }

    public int getOutputHeight() {
        return outputHeight;
    }

    public void setOutputHeight(int outputHeight) {
        this.outputHeight = outputHeight;
    }

    public String getOutputContentType() {
        return outputContentType;
    }

    public void setOutputContentType(String outputContentType) {
        this.outputContentType = outputContentType;
    }

    public Duration getStaleAfter() {
        return staleAfter;
    }

    public void setStaleAfter(Duration staleAfter) {
        this.staleAfter = staleAfter;
    }

    public int getSweeperBatchSize() {
        return sweeperBatchSize;
    }

    public void setSweeperBatchSize(int sweeperBatchSize) {
        this.sweeperBatchSize = sweeperBatchSize;
    }

    public long getSweeperDelayMs() {
        return sweeperDelayMs;
    }

    public void setSweeperDelayMs(long sweeperDelayMs) {
        this.sweeperDelayMs = sweeperDelayMs;
    }

    public Map<String, StyleModel> getStyles() {
        return styles;
    }

    public void setStyles(Map<String, StyleModel> styles) {
        this.styles = styles;
    }

    /**
     * Provider model backing one thumbnail style. {@code model} is {@code owner/name}.
     */
    public static class StyleModel {
        private String model;
        private String version;
        private String triggerWord;
        private boolean acceptsNegativePrompt = false;

        public StyleModel() {
        }

        public StyleModel(String model, String version, String triggerWord) {
            this.model = model;
            this.version = version;
            this.triggerWord = triggerWord;
        }

        public String owner() {
            int slash = model == null ? -1 : model.indexOf('/');
            return slash < 0 ? null : model.substring(0, slash);
        }

        public String name() {
            int slash = model == null ? -1 : model.indexOf('/');
            return slash < 0 ? null : model.substring(slash + 1);
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getTriggerWord() {
            return triggerWord;
        }

        public void setTriggerWord(String triggerWord) {
            this.triggerWord = triggerWord;
        }

        public boolean isAcceptsNegativePrompt() {
            return acceptsNegativePrompt;
        }

        public void setAcceptsNegativePrompt(boolean acceptsNegativePrompt) {
            this.acceptsNegativePrompt = acceptsNegativePrompt;
        }
    }
}
