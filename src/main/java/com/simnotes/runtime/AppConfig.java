package com.simnotes.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private StoreConfig store = new StoreConfig();
    private QueryConfig query = new QueryConfig();
    private IndexConfig index = new IndexConfig();

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public QueryConfig getQuery() {
        return query;
    }

    public void setQuery(QueryConfig query) {
        this.query = query == null ? new QueryConfig() : query;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "ollama";
        private String host = "http://localhost:11434";
        private String model = "nomic-embed-text";
        private int dimension = 768;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String provider = "qdrant";
        private String host = "http://localhost:6333";
        private String collection = "obsidian_notes";
        private String apiKey;
        private String distance = "cosine";
        private String localPath = ".simnotes/vectors.json";

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getDistance() {
            return distance;
        }

        public void setDistance(String distance) {
            this.distance = distance;
        }

        public String getLocalPath() {
            return localPath;
        }

        public void setLocalPath(String localPath) {
            this.localPath = localPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryConfig {
        private int limit = 5;
        private double scoreThreshold = 0.70;

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public double getScoreThreshold() {
            return scoreThreshold;
        }

        public void setScoreThreshold(double scoreThreshold) {
            this.scoreThreshold = scoreThreshold;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private List<String> extensions = new ArrayList<>(List.of(".md"));
        private boolean skipUnchanged = true;
        private int parallelism = 1;
        private int progressInterval = 10;
        private String ledgerPath = ".simnotes/index-ledger.json";

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions == null ? new ArrayList<>() : extensions;
        }

        public boolean isSkipUnchanged() {
            return skipUnchanged;
        }

        public void setSkipUnchanged(boolean skipUnchanged) {
            this.skipUnchanged = skipUnchanged;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public int getProgressInterval() {
            return progressInterval;
        }

        public void setProgressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
        }

        public String getLedgerPath() {
            return ledgerPath;
        }

        public void setLedgerPath(String ledgerPath) {
            this.ledgerPath = ledgerPath;
        }
    }
}
