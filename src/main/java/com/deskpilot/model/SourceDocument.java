package com.deskpilot.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An ingested file. Immutable: re-ingesting the same id produces a new instance with a
 * higher version rather than mutating this one.
 */
public record SourceDocument(String id, String filename, String format, byte[] payload, Instant ingestedAt, int version) {

    public SourceDocument {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(format, "format");
        payload = payload == null ? new byte[0] : payload;
        filename = filename == null || filename.isBlank() ? "uploaded.bin" : filename;
        ingestedAt = ingestedAt == null ? Instant.now() : ingestedAt;
    }

    public int sizeBytes() {
        return this.payload.length;
    }

    @Override
    public String toString() {
        return "SourceDocument[id=" + this.id + ", filename=" + this.filename + ", format=" + this.format
                + ", bytes=" + this.payload.length + ", version=" + this.version + "]";
    }
}
