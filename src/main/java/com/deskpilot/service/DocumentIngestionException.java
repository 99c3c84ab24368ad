package com.deskpilot.service;

/**
 * Ingestion of one document failed. The cause is the underlying format, extraction,
 * embedding or index failure.
 */
public class DocumentIngestionException extends RuntimeException {
    private final String documentId;
    private final String filename;

    public DocumentIngestionException(String documentId, String filename, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
        this.filename = filename;
    }

    public String getDocumentId() {
        return this.documentId;
    }

    public String getFilename() {
        return this.filename;
    }
}
