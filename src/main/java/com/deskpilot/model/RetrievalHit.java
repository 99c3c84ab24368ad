package com.deskpilot.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A candidate passage from either retrieval path with a relevance score normalized to [0,1].
 */
public record RetrievalHit(
        HitSource source,
        double score,
        String text,
        String provenanceId,
        String title,
        String url,
        String label,
        RecordKind kind,
        String category,
        int startOffset,
        int endOffset,
        double extractionConfidence,
        Instant updatedAt) {

    public static final int NO_OFFSET = -1;

    public RetrievalHit {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(provenanceId, "provenanceId");
        text = text == null ? "" : text;
        score = clamp(score);
        extractionConfidence = clamp(extractionConfidence);
    }

    public static RetrievalHit fromRecord(StructuredRecord record, double score) {
        return new RetrievalHit(HitSource.STRUCTURED, score, record.text(), record.id(), record.title(), record.url(),
                null, record.kind(), record.category(), NO_OFFSET, NO_OFFSET, 1.0, record.updatedAt());
    }

    public RetrievalHit withScore(double newScore) {
        return new RetrievalHit(this.source, newScore, this.text, this.provenanceId, this.title, this.url, this.label,
                this.kind, this.category, this.startOffset, this.endOffset, this.extractionConfidence, this.updatedAt);
    }

    public boolean hasOffsets() {
        return this.startOffset >= 0 && this.endOffset > this.startOffset;
    }

    public boolean isOcrDerived() {
        return this.label != null && this.label.startsWith(ExtractedUnit.OCR_LABEL);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
