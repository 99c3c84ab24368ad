package com.deskpilot.model;

import java.time.Instant;

/**
 * A ticket or knowledge-base article as returned by the external record store.
 */
public record StructuredRecord(String id, String title, String text, RecordKind kind, Instant updatedAt, String category, String url) {

    public StructuredRecord {
        title = title == null ? "" : title;
        text = text == null ? "" : text;
    }
}
