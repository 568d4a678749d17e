package com.docrag.ingest;

@FunctionalInterface
public interface IngestionProgressListener {
    IngestionProgressListener NONE = (current, total) -> {
    };

    /**
     * Called after chunk {@code current} of {@code total} has been embedded and stored.
     */
    void onProgress(int current, int total);
}
