package com.simnotes.embedding;

import java.util.Locale;

import com.simnotes.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private EmbeddingServices() {
    }

    public static EmbeddingService create(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        String provider = config.getProvider() == null ? "ollama" : config.getProvider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "ollama" -> new OllamaEmbeddingService(httpClient, config.getHost(), config.getModel(), config.getDimension());
            case "hashing" -> new HashingEmbeddingService(config.getDimension());
            default -> throw new IllegalArgumentException("Unknown embedding.provider: " + config.getProvider());
        };
    }
}
