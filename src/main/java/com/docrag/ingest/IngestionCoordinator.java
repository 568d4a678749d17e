package com.docrag.ingest;

import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs ingestions on a worker pool. Callers get a request id back immediately and poll
 * {@link #progress(String)}; failures end up in the progress record, never on the worker thread.
 */
public class IngestionCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final IngestionService ingestionService;
    private final IngestionProgressTracker tracker;
    private final ExecutorService executor;

    public IngestionCoordinator(IngestionService ingestionService, IngestionProgressTracker tracker, int workerThreads) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive: " + workerThreads);
        }
        this.ingestionService = ingestionService;
        this.tracker = tracker;
        this.executor = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
    }

    public String submit(Path file, String displayName) {
        String requestId = UUID.randomUUID().toString();
        tracker.start(requestId);
        try {
            executor.execute(() -> run(requestId, file, displayName));
            log.info("Queued ingestion {} for {}", requestId, file);
        } catch (RejectedExecutionException e) {
            log.error("Ingestion {} rejected: coordinator is shut down", requestId, e);
            tracker.fail(requestId, "Ingestion rejected: coordinator is shut down");
        }
        return requestId;
    }

    public Optional<IngestionProgress> progress(String requestId) {
        return tracker.get(requestId);
    }

    private void run(String requestId, Path file, String displayName) {
        try {
            long documentId = ingestionService.ingest(file, displayName,
                    (current, total) -> tracker.update(requestId, current, total));
            tracker.complete(requestId, documentId);
        } catch (IngestionException e) {
            log.error("Ingestion {} failed ({}): {}", requestId, e.kind(), e.getMessage());
            tracker.fail(requestId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Ingestion {} failed unexpectedly", requestId, e);
            tracker.fail(requestId, "Unexpected error: " + e.getMessage());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Ingestion workers did not finish within {}s, interrupting", SHUTDOWN_WAIT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "ingestion-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
