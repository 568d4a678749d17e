package com.docrag.ingest;

/**
 * Snapshot of one ingestion request. {@code documentId} is set once the request completes;
 * {@code error} once it fails.
 */
public record IngestionProgress(
        String requestId,
        int current,
        int total,
        IngestionStatus status,
        String error,
        Long documentId) {

    public int percentage() {
        if (total <= 0) {
            return 0;
        }
        return (int) ((long) current * 100 / total);
    }

    static IngestionProgress started(String requestId) {
        return new IngestionProgress(requestId, 0, 0, IngestionStatus.PROCESSING, null, null);
    }
}
