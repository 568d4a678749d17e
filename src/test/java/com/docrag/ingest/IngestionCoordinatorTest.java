package com.docrag.ingest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.docrag.embedding.HashingEmbeddingProvider;
import com.docrag.store.SqliteVectorStore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionCoordinatorTest {

    @TempDir
    Path tempDir;

    private SqliteVectorStore store;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        store = new SqliteVectorStore(tempDir.resolve("embeddings.db"));
        service = new IngestionService(new Chunker(500, 100, new TokenEstimator()), new HashingEmbeddingProvider(16),
                store, "test-embed", 1024 * 1024, 3);
    }

    @Test
    void shouldCompleteIngestionsInBackground() throws Exception {
        Path first = Files.writeString(tempDir.resolve("first.md"), "# One\n\nfirst document body\n");
        Path second = Files.writeString(tempDir.resolve("second.txt"), "second document body\n");

        try (IngestionCoordinator coordinator = new IngestionCoordinator(service,
                new IngestionProgressTracker(Duration.ofMinutes(1)), 2)) {
            String firstRequest = coordinator.submit(first, null);
            String secondRequest = coordinator.submit(second, "Second.txt");
            assertNotEquals(firstRequest, secondRequest);

            IngestionProgress firstDone = await(coordinator, firstRequest);
            IngestionProgress secondDone = await(coordinator, secondRequest);

            assertEquals(IngestionStatus.COMPLETED, firstDone.status());
            assertEquals(IngestionStatus.COMPLETED, secondDone.status());
            assertNotNull(firstDone.documentId());
            assertEquals(100, firstDone.percentage());
            assertEquals("Second.txt", store.findById(secondDone.documentId()).orElseThrow().displayName());
        }
        assertEquals(2, store.getAllDocuments().size());
    }

    @Test
    void shouldRecordFailureInProgress() throws Exception {
        try (IngestionCoordinator coordinator = new IngestionCoordinator(service,
                new IngestionProgressTracker(Duration.ofMinutes(1)), 1)) {
            String requestId = coordinator.submit(tempDir.resolve("missing.txt"), null);

            IngestionProgress failed = await(coordinator, requestId);

            assertEquals(IngestionStatus.FAILED, failed.status());
            assertTrue(failed.error().contains("File not found"));
        }
    }

    @Test
    void shouldFailSubmissionsAfterClose() throws Exception {
        IngestionCoordinator coordinator = new IngestionCoordinator(service,
                new IngestionProgressTracker(Duration.ofMinutes(1)), 1);
        coordinator.close();

        String requestId = coordinator.submit(tempDir.resolve("late.txt"), null);

        IngestionProgress progress = coordinator.progress(requestId).orElseThrow();
        assertEquals(IngestionStatus.FAILED, progress.status());
    }

    private static IngestionProgress await(IngestionCoordinator coordinator, String requestId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            IngestionProgress progress = coordinator.progress(requestId).orElseThrow();
            if (progress.status().isTerminal()) {
                return progress;
            }
            Thread.sleep(20);
        }
        throw new AssertionError("Ingestion " + requestId + " did not finish in time");
    }
}
