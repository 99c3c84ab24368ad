package com.deskpilot.model;

/**
 * Per-document result of a batch ingestion: either a result or the error that aborted
 * that document.
 */
public record IngestionOutcome(String filename, String documentId, IngestionResult result, String error) {

    public static IngestionOutcome success(IngestionResult result) {
        return new IngestionOutcome(result.filename(), result.documentId(), result, null);
    }

    public static IngestionOutcome failure(String filename, String documentId, String error) {
        return new IngestionOutcome(filename, documentId, null, error);
    }

    public boolean succeeded() {
        return this.result != null;
    }
}
