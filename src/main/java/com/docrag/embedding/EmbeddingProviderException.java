package com.docrag.embedding;

public class EmbeddingProviderException extends Exception {
    public enum Reason {
        UNREACHABLE,
        MODEL_NOT_LOADED,
        INPUT_TOO_LONG,
        INVALID_RESPONSE
    }

    private final Reason reason;

    public EmbeddingProviderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public EmbeddingProviderException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
