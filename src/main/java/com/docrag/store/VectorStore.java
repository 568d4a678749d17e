package com.docrag.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for documents and their embedded chunks. Pure data access: no ranking happens
 * here. Deleting a document removes its chunks.
 */
public interface VectorStore {
    Optional<StoredDocument> findByHash(String fileHash);

    Optional<StoredDocument> findById(long documentId);

    /**
     * @throws DuplicateDocumentException if a document with the same hash already exists
     */
    long createDocument(NewDocument document);

    void deleteDocument(long documentId);

    void saveChunk(long documentId, int chunkIndex, String chunkText, float[] embedding, int tokenCount);

    List<StoredChunk> getChunksByDocument(long documentId);

    /**
     * Every stored chunk ordered by document id then chunk index.
     */
    List<StoredChunk> getAllChunks();

    List<StoredDocument> getAllDocuments();

    int countChunks(long documentId);
}
