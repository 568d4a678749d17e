package com.docrag.ingest;

public class UnsupportedFileTypeException extends IngestionException {
    public UnsupportedFileTypeException(String message) {
        super(Kind.UNSUPPORTED_FILE_TYPE, message);
    }
}
