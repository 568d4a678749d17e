package com.docrag.store;

/**
 * Raised when a document insert collides with an existing row holding the same content hash.
 */
public class DuplicateDocumentException extends VectorStoreException {
    private final String fileHash;

    public DuplicateDocumentException(String fileHash, Throwable cause) {
        super("Document with hash " + fileHash + " already exists", cause);
        this.fileHash = fileHash;
    }

    public String fileHash() {
        return fileHash;
    }
}
