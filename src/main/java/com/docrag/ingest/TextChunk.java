package com.docrag.ingest;

public record TextChunk(String text, int estimatedTokens, ChunkMetadata metadata) {
}
