package com.deskpilot.rag.hybrid;

import com.deskpilot.model.RetrievalHit;
import java.util.List;

/**
 * Hits from both retrieval paths plus how each path fared.
 */
public record RetrievalResult(
        List<RetrievalHit> vectorHits,
        List<RetrievalHit> structuredHits,
        SourceStatus vectorStatus,
        SourceStatus structuredStatus,
        long elapsedMs) {

    public enum SourceStatus {
        OK,
        TIMED_OUT,
        FAILED,
        CANCELLED,
        SKIPPED;

        public boolean succeeded() {
            return this == OK;
        }
    }

    public RetrievalResult {
        vectorHits = vectorHits == null ? List.of() : List.copyOf(vectorHits);
        structuredHits = structuredHits == null ? List.of() : List.copyOf(structuredHits);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), List.of(), SourceStatus.OK, SourceStatus.OK, 0L);
    }

    public int totalHits() {
        return this.vectorHits.size() + this.structuredHits.size();
    }

    public boolean isPartial() {
        return isMissing(this.vectorStatus) || isMissing(this.structuredStatus);
    }

    private static boolean isMissing(SourceStatus status) {
        return !status.succeeded() && status != SourceStatus.SKIPPED;
    }
}
