package com.simnotes.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.simnotes.store.Distance;

public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String ENV_OLLAMA_HOST = "SIMNOTES_OLLAMA_HOST";
    static final String ENV_EMBEDDING_MODEL = "SIMNOTES_EMBEDDING_MODEL";
    static final String ENV_QDRANT_HOST = "SIMNOTES_QDRANT_HOST";
    static final String ENV_QDRANT_API_KEY = "SIMNOTES_QDRANT_API_KEY";
    static final String ENV_COLLECTION = "SIMNOTES_COLLECTION";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    public ConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    public AppConfig load(Path config) throws IOException {
        AppConfig appConfig;
        if (config == null || !Files.exists(config)) {
            log.info("No config file at {}, using defaults", config);
            appConfig = new AppConfig();
        } else {
            appConfig = mapper.readValue(config.toFile(), AppConfig.class);
        }
        applyEnvironment(appConfig);
        validate(appConfig);
        return appConfig;
    }

    void applyEnvironment(AppConfig config) {
        override(ENV_OLLAMA_HOST, config.getEmbedding()::setHost);
        override(ENV_EMBEDDING_MODEL, config.getEmbedding()::setModel);
        override(ENV_QDRANT_HOST, config.getStore()::setHost);
        override(ENV_QDRANT_API_KEY, config.getStore()::setApiKey);
        override(ENV_COLLECTION, config.getStore()::setCollection);
    }

    public static void validate(AppConfig config) {
        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        if (embedding.getDimension() <= 0) {
            throw new IllegalArgumentException("embedding.dimension must be positive, got " + embedding.getDimension());
        }
        requireOneOf("embedding.provider", embedding.getProvider(), "ollama", "hashing");
        requireOneOf("store.provider", config.getStore().getProvider(), "qdrant", "local");
        Distance.parse(config.getStore().getDistance());
        if (config.getStore().getCollection() == null || config.getStore().getCollection().isBlank()) {
            throw new IllegalArgumentException("store.collection must not be blank");
        }
        AppConfig.QueryConfig query = config.getQuery();
        if (query.getLimit() <= 0) {
            throw new IllegalArgumentException("query.limit must be positive, got " + query.getLimit());
        }
        if (query.getScoreThreshold() < 0.0 || query.getScoreThreshold() > 1.0) {
            throw new IllegalArgumentException("query.scoreThreshold must be within [0, 1], got " + query.getScoreThreshold());
        }
        AppConfig.IndexConfig index = config.getIndex();
        if (index.getParallelism() <= 0) {
            throw new IllegalArgumentException("index.parallelism must be positive, got " + index.getParallelism());
        }
        if (index.getProgressInterval() <= 0) {
            throw new IllegalArgumentException("index.progressInterval must be positive, got " + index.getProgressInterval());
        }
        if (index.getExtensions().isEmpty()) {
            throw new IllegalArgumentException("index.extensions must list at least one file extension");
        }
    }

    private static void requireOneOf(String key, String value, String... allowed) {
        for (String candidate : allowed) {
            if (candidate.equalsIgnoreCase(value)) {
                return;
            }
        }
        throw new IllegalArgumentException(key + " must be one of " + String.join(", ", allowed) + ", got " + value);
    }

    private void override(String variable, Consumer<String> setter) {
        String value = environment.get(variable);
        if (value != null && !value.isBlank()) {
            log.debug("config.override variable={}", variable);
            setter.accept(value.strip());
        }
    }
}
