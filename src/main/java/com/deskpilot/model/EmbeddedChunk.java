package com.deskpilot.model;

import java.util.Objects;

public record EmbeddedChunk(Chunk chunk, float[] vector, String modelId) {

    public EmbeddedChunk {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(modelId, "modelId");
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Embedded chunk requires a non-empty vector");
        }
    }

    public String documentId() {
        return this.chunk.documentId();
    }

    public String key() {
        return this.chunk.key();
    }
}
