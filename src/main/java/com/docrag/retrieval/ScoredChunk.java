package com.docrag.retrieval;

import com.docrag.store.StoredChunk;

public record ScoredChunk(StoredChunk chunk, double score) {
    public ScoredChunk withScore(double newScore) {
        return new ScoredChunk(chunk, newScore);
    }
}
