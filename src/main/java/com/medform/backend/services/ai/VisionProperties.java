package com.medform.backend.services.ai;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "medform.vision")
public class VisionProperties {

    /**
     * Enables the vision language-model extractor.
     */
    private boolean enabled = true;

    /**
     * OpenAI API key. The extractor reports NOT_CONFIGURED while empty.
     */
    private String apiKey = "";

    private String model = "gpt-4o";

    private int maxTokens = 4000;

    private double temperature = 0.0;

    private int timeoutSeconds = 60;

    /**
     * Render DPI for PDF pages sent to the model.
     */
    private int renderDpi = 300;

    /**
     * Encoded page images above this size are downscaled before upload.
     */
    private long maxImageBytes = 15_000_000L;

    /**
     * Model calls per document, including the first one. Only calls that throw are retried.
     */
    private int maxAttempts = 1;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getRenderDpi() {
        return renderDpi;
    }

    public void setRenderDpi(int renderDpi) {
        this.renderDpi = renderDpi;
    }

    public long getMaxImageBytes() {
        return maxImageBytes;
    }

    public void setMaxImageBytes(long maxImageBytes) {
        this.maxImageBytes = maxImageBytes;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
