package com.docrag.embedding;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docrag.ingest.TokenEstimator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Calls Ollama's {@code /api/embeddings} endpoint. Inputs whose token estimate exceeds the model
 * context are rejected before any request is sent.
 */
public class OllamaEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final TokenEstimator tokenEstimator;
    private final int maxInputTokens;

    public OllamaEmbeddingProvider(OkHttpClient httpClient, String baseUrl, TokenEstimator tokenEstimator, int maxInputTokens) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.tokenEstimator = tokenEstimator;
        this.maxInputTokens = maxInputTokens;
    }

    @Override
    public float[] embed(String model, String text) throws EmbeddingProviderException {
        int words = TokenEstimator.wordCount(text);
        int estimatedTokens = tokenEstimator.tokensForWords(words);
        if (estimatedTokens > maxInputTokens) {
            throw new EmbeddingProviderException(EmbeddingProviderException.Reason.INPUT_TOO_LONG,
                    "Input text is too long: approximately %d tokens (%d words). Model '%s' accepts at most %d tokens. Reduce the chunk size."
                            .formatted(estimatedTokens, words, model, maxInputTokens));
        }

        Request request;
        try {
            String payload = mapper.writeValueAsString(Map.of("model", model, "prompt", text));
            request = new Request.Builder()
                    .url(baseUrl + "/api/embeddings")
                    .post(RequestBody.create(payload, JSON))
                    .build();
        } catch (JsonProcessingException e) {
            throw new EmbeddingProviderException(EmbeddingProviderException.Reason.INVALID_RESPONSE,
                    "Cannot serialize embedding request", e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            log.debug("Ollama embeddings status={} body(first 200)={}", response.code(),
                    raw.length() > 200 ? raw.substring(0, 200) : raw);
            return parse(model, response.code(), response.isSuccessful(), raw);
        } catch (IOException e) {
            throw new EmbeddingProviderException(EmbeddingProviderException.Reason.UNREACHABLE,
                    "Failed to reach Ollama at " + baseUrl + ". Make sure it is running and model '" + model + "' is pulled: "
                            + e.getMessage(), e);
        }
    }

    private float[] parse(String model, int status, boolean successful, String raw) throws EmbeddingProviderException {
        JsonNode root;
        try {
            root = raw.isBlank() ? mapper.createObjectNode() : mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new EmbeddingProviderException(EmbeddingProviderException.Reason.INVALID_RESPONSE,
                    "Ollama returned malformed JSON (HTTP " + status + ")", e);
        }

        String error = root.path("error").asText("");
        if (!successful || !error.isEmpty()) {
            String lowered = error.toLowerCase(Locale.ROOT);
            if (status == 404 || (lowered.contains("model") && lowered.contains("not found"))) {
                throw new EmbeddingProviderException(EmbeddingProviderException.Reason.MODEL_NOT_LOADED,
                        "Model '" + model + "' is not available in Ollama: " + (error.isEmpty() ? "HTTP " + status : error));
            }
            throw new EmbeddingProviderException(EmbeddingProviderException.Reason.INVALID_RESPONSE,
                    "Ollama API error (HTTP " + status + "): " + (error.isEmpty() ? "no details" : error));
        }

        JsonNode vectorNode = root.path("embedding");
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            throw new EmbeddingProviderException(EmbeddingProviderException.Reason.INVALID_RESPONSE,
                    "Ollama returned no embedding for model '" + model + "'. The model may not be loaded.");
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return out;
    }
}
