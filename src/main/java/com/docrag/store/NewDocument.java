package com.docrag.store;

public record NewDocument(
        String fileName,
        String filePath,
        String displayName,
        String fileHash,
        long fileSizeBytes,
        int totalChunks,
        String embeddingModel) {
    public NewDocument {
        if (displayName == null || displayName.isBlank()) {
            displayName = fileName;
        }
    }
}
