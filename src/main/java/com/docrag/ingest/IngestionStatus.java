package com.docrag.ingest;

public enum IngestionStatus {
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }
}
