package com.docrag.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private StoreConfig store = new StoreConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private RerankerConfig reranker = new RerankerConfig();

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public RerankerConfig getReranker() {
        return reranker;
    }

    public void setReranker(RerankerConfig reranker) {
        this.reranker = reranker == null ? new RerankerConfig() : reranker;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "ollama";
        private String baseUrl = "http://localhost:11434";
        private String model = "nomic-embed-text";
        private int maxInputTokens = 8192;
        private int hashingDimension = 384;
        private int connectTimeoutMs = 10000;
        private int readTimeoutMs = 60000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxInputTokens() {
            return maxInputTokens;
        }

        public void setMaxInputTokens(int maxInputTokens) {
            this.maxInputTokens = maxInputTokens;
        }

        public int getHashingDimension() {
            return hashingDimension;
        }

        public void setHashingDimension(int hashingDimension) {
            this.hashingDimension = hashingDimension;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int maxTokensPerChunk = 500;
        private int overlapTokens = 100;
        private double wordsPerToken = 0.75;

        public int getMaxTokensPerChunk() {
            return maxTokensPerChunk;
        }

        public void setMaxTokensPerChunk(int maxTokensPerChunk) {
            this.maxTokensPerChunk = maxTokensPerChunk;
        }

        public int getOverlapTokens() {
            return overlapTokens;
        }

        public void setOverlapTokens(int overlapTokens) {
            this.overlapTokens = overlapTokens;
        }

        public double getWordsPerToken() {
            return wordsPerToken;
        }

        public void setWordsPerToken(double wordsPerToken) {
            this.wordsPerToken = wordsPerToken;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private long maxFileSizeBytes = 10L * 1024 * 1024;
        private int workerThreads = 2;
        private long progressRetentionMs = 60000;
        private int maxCreateAttempts = 3;

        public long getMaxFileSizeBytes() {
            return maxFileSizeBytes;
        }

        public void setMaxFileSizeBytes(long maxFileSizeBytes) {
            this.maxFileSizeBytes = maxFileSizeBytes;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public long getProgressRetentionMs() {
            return progressRetentionMs;
        }

        public void setProgressRetentionMs(long progressRetentionMs) {
            this.progressRetentionMs = progressRetentionMs;
        }

        public int getMaxCreateAttempts() {
            return maxCreateAttempts;
        }

        public void setMaxCreateAttempts(int maxCreateAttempts) {
            this.maxCreateAttempts = maxCreateAttempts;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String databasePath = ".docrag/embeddings.db";

        public String getDatabasePath() {
            return databasePath;
        }

        public void setDatabasePath(String databasePath) {
            this.databasePath = databasePath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private double textThreshold = 0.65;
        private double codeThreshold = 0.45;
        private int defaultTopK = 5;
        private int maxTopK = 10;
        private boolean lexicalBoost = true;
        private int rerankCandidates = 20;
        private int contextTokenBudget = 2000;

        public double getTextThreshold() {
            return textThreshold;
        }

        public void setTextThreshold(double textThreshold) {
            this.textThreshold = textThreshold;
        }

        public double getCodeThreshold() {
            return codeThreshold;
        }

        public void setCodeThreshold(double codeThreshold) {
            this.codeThreshold = codeThreshold;
        }

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public int getMaxTopK() {
            return maxTopK;
        }

        public void setMaxTopK(int maxTopK) {
            this.maxTopK = maxTopK;
        }

        public boolean isLexicalBoost() {
            return lexicalBoost;
        }

        public void setLexicalBoost(boolean lexicalBoost) {
            this.lexicalBoost = lexicalBoost;
        }

        public int getRerankCandidates() {
            return rerankCandidates;
        }

        public void setRerankCandidates(int rerankCandidates) {
            this.rerankCandidates = rerankCandidates;
        }

        public int getContextTokenBudget() {
            return contextTokenBudget;
        }

        public void setContextTokenBudget(int contextTokenBudget) {
            this.contextTokenBudget = contextTokenBudget;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RerankerConfig {
        private boolean enabled = false;
        private String baseUrl = "https://router.huggingface.co/models";
        private String model = "BAAI/bge-reranker-v2-m3";
        private String apiKey = "";
        private double threshold = 0.5;
        private int connectTimeoutMs = 10000;
        private int readTimeoutMs = 30000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? "" : apiKey;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }
}
