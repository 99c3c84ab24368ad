package com.deskpilot.model;

import java.util.Map;

/**
 * A bounded passage cut from one {@link ExtractedUnit}. Offsets are {@code [start, end)}
 * character positions in the unit text.
 */
public record Chunk(String documentId, String label, int ordinal, String text, int startOffset, int endOffset, Map<String, Object> metadata) {

    public Chunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String key() {
        return key(this.documentId, this.label, this.ordinal);
    }

    public static String key(String documentId, String label, int ordinal) {
        return documentId + "::" + label + "::" + ordinal;
    }

    public int length() {
        return this.text.length();
    }
}
