package com.simnotes.store;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

import com.simnotes.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class VectorStores {
    private VectorStores() {
    }

    public static VectorStore create(AppConfig.StoreConfig config, OkHttpClient httpClient) throws IOException {
        String provider = config.getProvider() == null ? "qdrant" : config.getProvider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "qdrant" -> new QdrantVectorStore(httpClient, config.getHost(), config.getApiKey());
            case "local" -> LocalJsonVectorStore.open(Path.of(config.getLocalPath()));
            default -> throw new IllegalArgumentException("Unknown store.provider: " + config.getProvider());
        };
    }
}
