package com.docrag.ingest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionProgressTrackerTest {

    @Test
    void shouldReportPercentageWhileProcessing() {
        IngestionProgressTracker tracker = new IngestionProgressTracker(Duration.ofSeconds(60), new ManualClock());

        tracker.start("req-1");
        assertEquals(0, tracker.get("req-1").orElseThrow().percentage());

        tracker.update("req-1", 1, 3);
        IngestionProgress progress = tracker.get("req-1").orElseThrow();
        assertEquals(IngestionStatus.PROCESSING, progress.status());
        assertEquals(33, progress.percentage());
        assertNull(progress.documentId());
    }

    @Test
    void shouldKeepTerminalRecordUntilRetentionElapses() {
        ManualClock clock = new ManualClock();
        IngestionProgressTracker tracker = new IngestionProgressTracker(Duration.ofSeconds(60), clock);
        tracker.start("req-1");
        tracker.update("req-1", 2, 4);

        tracker.complete("req-1", 42L);
        clock.advance(Duration.ofSeconds(59));

        IngestionProgress done = tracker.get("req-1").orElseThrow();
        assertEquals(IngestionStatus.COMPLETED, done.status());
        assertEquals(4, done.current());
        assertEquals(100, done.percentage());
        assertEquals(42L, done.documentId());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(tracker.get("req-1").isEmpty());
        assertEquals(0, tracker.size());
    }

    @Test
    void shouldNeverExpireRequestsStillProcessing() {
        ManualClock clock = new ManualClock();
        IngestionProgressTracker tracker = new IngestionProgressTracker(Duration.ofSeconds(1), clock);
        tracker.start("slow");

        clock.advance(Duration.ofHours(1));

        assertTrue(tracker.get("slow").isPresent());
    }

    @Test
    void shouldIgnoreUpdatesAfterFailure() {
        IngestionProgressTracker tracker = new IngestionProgressTracker(Duration.ofSeconds(60), new ManualClock());
        tracker.start("req-1");
        tracker.update("req-1", 1, 5);

        tracker.fail("req-1", "Embedding failed");
        tracker.update("req-1", 2, 5);

        IngestionProgress failed = tracker.get("req-1").orElseThrow();
        assertEquals(IngestionStatus.FAILED, failed.status());
        assertEquals("Embedding failed", failed.error());
        assertEquals(1, failed.current());
    }

    @Test
    void shouldReturnEmptyForUnknownRequest() {
        IngestionProgressTracker tracker = new IngestionProgressTracker(Duration.ofSeconds(60));

        assertTrue(tracker.get("nope").isEmpty());
    }

    static final class ManualClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
