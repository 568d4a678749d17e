package com.docrag.ingest;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress records keyed by request id. A record that reached a terminal status is kept for
 * {@code retention} after it finished so a poller can observe the outcome, then dropped on the
 * next access.
 */
public class IngestionProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(IngestionProgressTracker.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    public IngestionProgressTracker(Duration retention) {
        this(retention, Clock.systemUTC());
    }

    public IngestionProgressTracker(Duration retention, Clock clock) {
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative: " + retention);
        }
        this.retention = retention;
        this.clock = clock;
    }

    public void start(String requestId) {
        evictExpired();
        entries.put(requestId, new Entry(IngestionProgress.started(requestId), -1));
    }

    public void update(String requestId, int current, int total) {
        entries.computeIfPresent(requestId, (id, entry) -> {
            if (entry.progress().status() != IngestionStatus.PROCESSING) {
                return entry;
            }
            return new Entry(new IngestionProgress(id, current, total, IngestionStatus.PROCESSING, null, null), -1);
        });
    }

    public void complete(String requestId, long documentId) {
        long now = clock.millis();
        entries.compute(requestId, (id, entry) -> {
            int total = entry == null ? 0 : entry.progress().total();
            return new Entry(new IngestionProgress(id, total, total, IngestionStatus.COMPLETED, null, documentId), now);
        });
    }

    public void fail(String requestId, String error) {
        long now = clock.millis();
        entries.compute(requestId, (id, entry) -> {
            int current = entry == null ? 0 : entry.progress().current();
            int total = entry == null ? 0 : entry.progress().total();
            return new Entry(new IngestionProgress(id, current, total, IngestionStatus.FAILED, error, null), now);
        });
    }

    public Optional<IngestionProgress> get(String requestId) {
        evictExpired();
        Entry entry = entries.get(requestId);
        return entry == null ? Optional.empty() : Optional.of(entry.progress());
    }

    public int size() {
        evictExpired();
        return entries.size();
    }

    void evictExpired() {
        long cutoff = clock.millis() - retention.toMillis();
        entries.entrySet().removeIf(e -> {
            long finishedAt = e.getValue().finishedAt();
            boolean expired = finishedAt >= 0 && finishedAt <= cutoff;
            if (expired) {
                log.debug("Dropping progress record {} ({})", e.getKey(), e.getValue().progress().status());
            }
            return expired;
        });
    }

    private record Entry(IngestionProgress progress, long finishedAt) {
    }
}
