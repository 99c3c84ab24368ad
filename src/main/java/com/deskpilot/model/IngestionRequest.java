package com.deskpilot.model;

/**
 * One file of a batch ingestion. {@code documentId} may be null to let the service assign one.
 */
public record IngestionRequest(String filename, byte[] payload, String declaredFormat, String documentId) {

    public IngestionRequest {
        payload = payload == null ? new byte[0] : payload;
    }
}
