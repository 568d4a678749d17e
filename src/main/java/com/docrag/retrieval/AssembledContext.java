package com.docrag.retrieval;

import java.util.List;

public record AssembledContext(String text, List<Long> citedChunkIds, int totalTokens) {
    public AssembledContext {
        citedChunkIds = List.copyOf(citedChunkIds);
    }

    public static AssembledContext empty() {
        return new AssembledContext("", List.of(), 0);
    }

    public boolean isEmpty() {
        return citedChunkIds.isEmpty();
    }
}
