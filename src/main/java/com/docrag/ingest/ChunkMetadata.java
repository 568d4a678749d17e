package com.docrag.ingest;

import java.util.List;

/**
 * Structural position of a chunk. {@code level} is 0 for body text and 1-6 for heading depth;
 * {@code startLine} is 0-based.
 */
public record ChunkMetadata(List<String> headingPath, int level, int startLine) {
    public ChunkMetadata {
        headingPath = headingPath == null ? List.of() : List.copyOf(headingPath);
    }

    public static ChunkMetadata body(int startLine) {
        return new ChunkMetadata(List.of(), 0, startLine);
    }

    public String topLevelHeading() {
        return headingPath.isEmpty() ? null : headingPath.get(0);
    }
}
