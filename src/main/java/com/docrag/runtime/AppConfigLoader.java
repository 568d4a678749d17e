package com.docrag.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads {@link AppConfig} from YAML and applies environment overrides. A missing file yields
 * defaults.
 */
public class AppConfigLoader {
    static final String EMBEDDING_URL_ENV = "DOCRAG_EMBEDDING_URL";
    static final String RERANK_API_KEY_ENV = "DOCRAG_RERANK_API_KEY";
    static final String USE_RERANKING_ENV = "DOCRAG_USE_RERANKING";

    private static final Logger log = LoggerFactory.getLogger(AppConfigLoader.class);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, String> environment;

    public AppConfigLoader() {
        this(System.getenv());
    }

    public AppConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    public AppConfig load(Path configPath) throws IOException {
        AppConfig config;
        if (configPath == null || !Files.exists(configPath)) {
            log.info("Config file {} not found, using defaults", configPath);
            config = new AppConfig();
        } else {
            config = mapper.readValue(configPath.toFile(), AppConfig.class);
        }
        applyEnvironment(config);
        return config;
    }

    private void applyEnvironment(AppConfig config) {
        String embeddingUrl = environment.get(EMBEDDING_URL_ENV);
        if (embeddingUrl != null && !embeddingUrl.isBlank()) {
            config.getEmbedding().setBaseUrl(embeddingUrl);
        }
        String apiKey = environment.get(RERANK_API_KEY_ENV);
        if (apiKey != null && !apiKey.isBlank() && config.getReranker().getApiKey().isBlank()) {
            config.getReranker().setApiKey(apiKey);
        }
        String useReranking = environment.get(USE_RERANKING_ENV);
        if (useReranking != null && !useReranking.isBlank()) {
            config.getReranker().setEnabled(Boolean.parseBoolean(useReranking.strip()));
        }
    }
}
