package com.docrag.store;

public record StoredDocument(
        long id,
        String fileName,
        String filePath,
        String displayName,
        String fileHash,
        long fileSizeBytes,
        int totalChunks,
        String embeddingModel,
        long createdAt,
        long updatedAt) {
}
