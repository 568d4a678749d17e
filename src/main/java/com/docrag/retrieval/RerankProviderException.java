package com.docrag.retrieval;

public class RerankProviderException extends Exception {
    public RerankProviderException(String message) {
        super(message);
    }

    public RerankProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
