package com.deskpilot.model;

public record IngestionResult(String documentId, String filename, String format, int version, int unitCount, int chunkCount) {

    public boolean indexed() {
        return this.chunkCount > 0;
    }
}
