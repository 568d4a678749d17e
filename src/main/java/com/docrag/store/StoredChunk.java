package com.docrag.store;

import java.util.Arrays;
import java.util.Objects;

/**
 * A persisted chunk. {@code sourceName} is the owning document's display name, joined in at read
 * time for citations. Equality compares the embedding by content; the array is copied in and out.
 */
public record StoredChunk(
        long id,
        long documentId,
        int chunkIndex,
        String chunkText,
        float[] embedding,
        int tokenCount,
        long createdAt,
        String sourceName) {

    public StoredChunk {
        embedding = embedding == null ? new float[0] : embedding.clone();
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public int dimension() {
        return embedding.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof StoredChunk that)) {
            return false;
        }
        return id == that.id
                && documentId == that.documentId
                && chunkIndex == that.chunkIndex
                && tokenCount == that.tokenCount
                && createdAt == that.createdAt
                && Objects.equals(chunkText, that.chunkText)
                && Objects.equals(sourceName, that.sourceName)
                && Arrays.equals(embedding, that.embedding);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, documentId, chunkIndex, chunkText, tokenCount, createdAt, sourceName);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "StoredChunk[id=" + id
                + ", documentId=" + documentId
                + ", chunkIndex=" + chunkIndex
                + ", sourceName=" + sourceName
                + ", tokenCount=" + tokenCount
                + ", embedding=float[" + embedding.length + "]]";
    }
}
