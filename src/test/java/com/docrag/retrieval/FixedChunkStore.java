package com.docrag.retrieval;

import java.util.List;
import java.util.Optional;

import com.docrag.store.NewDocument;
import com.docrag.store.StoredChunk;
import com.docrag.store.StoredDocument;
import com.docrag.store.VectorStore;

/**
 * Read-only store over a fixed chunk list.
 */
class FixedChunkStore implements VectorStore {
    private final List<StoredChunk> chunks;

    FixedChunkStore(List<StoredChunk> chunks) {
        this.chunks = List.copyOf(chunks);
    }

    static StoredChunk chunk(long id, String text, int tokens, float... embedding) {
        return new StoredChunk(id, 1L, (int) id, text, embedding, tokens, 0L, "doc.md");
    }

    @Override
    public Optional<StoredDocument> findByHash(String fileHash) {
        return Optional.empty();
    }

    @Override
    public Optional<StoredDocument> findById(long documentId) {
        return Optional.empty();
    }

    @Override
    public long createDocument(NewDocument document) {
        throw new UnsupportedOperationException("read-only");
    }

    @Override
    public void deleteDocument(long documentId) {
        throw new UnsupportedOperationException("read-only");
    }

    @Override
    public void saveChunk(long documentId, int chunkIndex, String chunkText, float[] embedding, int tokenCount) {
        throw new UnsupportedOperationException("read-only");
    }

    @Override
    public List<StoredChunk> getChunksByDocument(long documentId) {
        return chunks.stream().filter(c -> c.documentId() == documentId).toList();
    }

    @Override
    public List<StoredChunk> getAllChunks() {
        return chunks;
    }

    @Override
    public List<StoredDocument> getAllDocuments() {
        return List.of();
    }

    @Override
    public int countChunks(long documentId) {
        return getChunksByDocument(documentId).size();
    }
}
