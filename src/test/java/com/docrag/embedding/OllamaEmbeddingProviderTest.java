package com.docrag.embedding;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.docrag.ingest.TokenEstimator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OllamaEmbeddingProviderTest {
    private static final MediaType JSON = MediaType.get("application/json");

    @Test
    void shouldPostPromptAndParseEmbedding() throws Exception {
        AtomicReference<Request> captured = new AtomicReference<>();
        OllamaEmbeddingProvider provider = provider(chain -> {
            captured.set(chain.request());
            return respond(chain, 200, "{\"embedding\":[0.25,-0.5,1.0]}");
        }, 8192);

        float[] embedding = provider.embed("nomic-embed-text", "hello world");

        assertArrayEquals(new float[] { 0.25f, -0.5f, 1.0f }, embedding);
        Request request = captured.get();
        assertEquals("http://ollama.test/api/embeddings", request.url().toString());
        assertEquals("POST", request.method());
        Buffer body = new Buffer();
        request.body().writeTo(body);
        JsonNode payload = new ObjectMapper().readTree(body.readUtf8());
        assertEquals("nomic-embed-text", payload.path("model").asText());
        assertEquals("hello world", payload.path("prompt").asText());
    }

    @Test
    void shouldRejectOversizedInputWithoutCallingServer() {
        AtomicInteger calls = new AtomicInteger();
        OllamaEmbeddingProvider provider = provider(chain -> {
            calls.incrementAndGet();
            return respond(chain, 200, "{\"embedding\":[1.0]}");
        }, 10);

        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> provider.embed("nomic-embed-text", "word ".repeat(9)));

        assertEquals(EmbeddingProviderException.Reason.INPUT_TOO_LONG, error.reason());
        assertTrue(error.getMessage().contains("12 tokens"));
        assertEquals(0, calls.get());
    }

    @Test
    void shouldReportMissingModel() {
        EmbeddingProviderException notFound = assertThrows(EmbeddingProviderException.class,
                () -> provider(chain -> respond(chain, 404, "{\"error\":\"model \\\"x\\\" not found, try pulling it first\"}"), 8192)
                        .embed("x", "hello"));
        assertEquals(EmbeddingProviderException.Reason.MODEL_NOT_LOADED, notFound.reason());

        EmbeddingProviderException inBody = assertThrows(EmbeddingProviderException.class,
                () -> provider(chain -> respond(chain, 500, "{\"error\":\"model 'x' not found\"}"), 8192)
                        .embed("x", "hello"));
        assertEquals(EmbeddingProviderException.Reason.MODEL_NOT_LOADED, inBody.reason());
    }

    @Test
    void shouldReportUnreachableServer() {
        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> provider(chain -> {
                    throw new IOException("Connection refused");
                }, 8192).embed("nomic-embed-text", "hello"));

        assertEquals(EmbeddingProviderException.Reason.UNREACHABLE, error.reason());
        assertTrue(error.getMessage().contains("http://ollama.test"));
    }

    @Test
    void shouldReportInvalidResponses() {
        assertReason(EmbeddingProviderException.Reason.INVALID_RESPONSE, "{\"embedding\":[]}", 200);
        assertReason(EmbeddingProviderException.Reason.INVALID_RESPONSE, "{}", 200);
        assertReason(EmbeddingProviderException.Reason.INVALID_RESPONSE, "not json", 200);
        assertReason(EmbeddingProviderException.Reason.INVALID_RESPONSE, "{\"error\":\"out of memory\"}", 500);
    }

    private static void assertReason(EmbeddingProviderException.Reason expected, String body, int status) {
        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> provider(chain -> respond(chain, status, body), 8192).embed("nomic-embed-text", "hello"));
        assertEquals(expected, error.reason(), body);
    }

    private static OllamaEmbeddingProvider provider(Interceptor interceptor, int maxInputTokens) {
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(interceptor).build();
        return new OllamaEmbeddingProvider(client, "http://ollama.test/", new TokenEstimator(), maxInputTokens);
    }

    private static Response respond(Interceptor.Chain chain, int code, String body) {
        return new Response.Builder()
                .request(chain.request())
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message(code == 200 ? "OK" : "Error")
                .body(ResponseBody.create(body, JSON))
                .build();
    }
}
