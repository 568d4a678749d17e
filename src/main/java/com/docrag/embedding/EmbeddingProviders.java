package com.docrag.embedding;

import java.time.Duration;
import java.util.Locale;

import com.docrag.ingest.TokenEstimator;
import com.docrag.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private EmbeddingProviders() {
    }

    public static EmbeddingProvider fromConfig(AppConfig.EmbeddingConfig config, TokenEstimator tokenEstimator) {
        String provider = config.getProvider() == null ? "ollama" : config.getProvider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "hashing" -> new HashingEmbeddingProvider(config.getHashingDimension());
            case "ollama" -> new OllamaEmbeddingProvider(
                    new OkHttpClient.Builder()
                            .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                            .readTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                            .build(),
                    config.getBaseUrl(),
                    tokenEstimator,
                    config.getMaxInputTokens());
            default -> throw new IllegalArgumentException("Unknown embedding provider '" + config.getProvider()
                    + "'. Supported providers: ollama, hashing");
        };
    }
}
