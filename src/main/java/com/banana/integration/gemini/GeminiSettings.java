package com.banana.integration.gemini;

import com.banana.config.ConfigService;

import java.net.URI;
import java.util.Objects;

/**
 * Endpoint, key and model names for the generation service.
 *
 * @param apiKey may be {@code null}; every call then fails with a missing-key error
 */
public record GeminiSettings(URI apiBase, String apiKey, String geminiModel, String imagenModel) {

    public GeminiSettings {
        Objects.requireNonNull(apiBase, "apiBase");
        Objects.requireNonNull(geminiModel, "geminiModel");
        Objects.requireNonNull(imagenModel, "imagenModel");
    }

    public static GeminiSettings from(ConfigService config) {
        return new GeminiSettings(
            config.getApiBase(),
            config.getApiKey().orElse(null),
            config.getGeminiModel(),
            config.getImagenModel());
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
