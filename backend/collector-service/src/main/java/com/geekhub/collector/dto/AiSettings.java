package com.geekhub.collector.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.geekhub.collector.exception.EnrichmentException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings for an OpenAI-compatible provider (OpenAI, OpenRouter, Ollama, custom endpoints).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AiSettings {

    public static final String DEFAULT_MODEL = "gpt-4o-mini";
    public static final double DEFAULT_TEMPERATURE = 0.3;

    private boolean enabled;

    private String provider;

    private String baseUrl;

    private String model;

    private String apiKey;

    private Double temperature;

    @JsonIgnore
    public String getModelOrDefault() {
        return model == null || model.isBlank() ? DEFAULT_MODEL : model;
    }

    @JsonIgnore
    public double getTemperatureOrDefault() {
        return temperature == null ? DEFAULT_TEMPERATURE : temperature;
    }

    /**
     * @throws EnrichmentException if the provider cannot be called with these settings
     */
    public void validate() {
        if (!enabled) {
            throw EnrichmentException.invalidSettings("AI features are disabled");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw EnrichmentException.invalidSettings("API key is not configured");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw EnrichmentException.invalidSettings("Base URL is not configured");
        }
    }

    /**
     * Key is never echoed back to clients.
     */
    @Override
    public String toString() {
        return "AiSettings(enabled=" + enabled + ", provider=" + provider + ", baseUrl=" + baseUrl
                + ", model=" + model + ", temperature=" + temperature + ")";
    }
}
