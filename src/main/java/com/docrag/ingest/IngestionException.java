package com.docrag.ingest;

import java.util.Objects;

/**
 * Failure of a single ingestion request. The {@link Kind} tells callers whether the input was
 * rejected before anything was stored or whether a partially written document was rolled back.
 */
public class IngestionException extends Exception {
    public enum Kind {
        UNSUPPORTED_FILE_TYPE,
        FILE_NOT_FOUND,
        UNREADABLE,
        EMPTY_FILE,
        FILE_TOO_LARGE,
        EMBEDDING_PROVIDER,
        STORAGE
    }

    private final Kind kind;

    public IngestionException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public IngestionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }
}
