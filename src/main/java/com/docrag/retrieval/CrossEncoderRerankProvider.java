package com.docrag.retrieval;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
 * Scores query/passage pairs with a hosted cross-encoder (HuggingFace inference format). The reply
 * may be a bare array of numbers or an object with a {@code scores} array.
 */
public class CrossEncoderRerankProvider implements RerankProvider {
    private static final Logger log = LoggerFactory.getLogger(CrossEncoderRerankProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String apiKey;

    public CrossEncoderRerankProvider(OkHttpClient httpClient, String baseUrl, String model, String apiKey) {
        this.httpClient = httpClient;
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.endpoint = base + "/" + model;
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    @Override
    public double[] score(String query, List<String> texts) throws RerankProviderException {
        String payload;
        try {
            payload = mapper.writeValueAsString(Map.of("inputs", Map.of("source_sentence", query, "sentences", texts)));
        } catch (JsonProcessingException e) {
            throw new RerankProviderException("Cannot serialize rerank request", e);
        }

        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (!apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new RerankProviderException("Reranker returned HTTP " + response.code() + ": " + abbreviate(raw));
            }
            return parse(raw, texts.size());
        } catch (IOException e) {
            throw new RerankProviderException("Failed to reach reranker at " + endpoint + ": " + e.getMessage(), e);
        }
    }

    private double[] parse(String raw, int expected) throws RerankProviderException {
        JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new RerankProviderException("Reranker returned malformed JSON", e);
        }
        if (root == null) {
            throw new RerankProviderException("Reranker returned an empty body");
        }
        if (root.has("error")) {
            throw new RerankProviderException("Reranker error: " + root.path("error").asText());
        }
        JsonNode scores = root.isArray() ? root : root.path("scores");
        if (!scores.isArray()) {
            throw new RerankProviderException("Unexpected reranker response: " + abbreviate(raw));
        }
        double[] out = new double[scores.size()];
        for (int i = 0; i < scores.size(); i++) {
            JsonNode value = scores.get(i);
            if (!value.isNumber()) {
                throw new RerankProviderException("Non-numeric score at position " + i);
            }
            out[i] = value.asDouble();
        }
        log.debug("Reranker returned {} scores for {} texts", out.length, expected);
        return out;
    }

    private static String abbreviate(String raw) {
        return raw.length() > 200 ? raw.substring(0, 200) : raw;
    }
}
