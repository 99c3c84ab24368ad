package com.deskpilot.model;

import java.util.List;

/**
 * Ranked, de-duplicated hits that fit the character budget, plus everything that was
 * left out and why.
 */
public record AssembledContext(List<RetrievalHit> hits, List<DroppedHit> dropped, int budgetChars, int usedChars) {

    public AssembledContext {
        hits = hits == null ? List.of() : List.copyOf(hits);
        dropped = dropped == null ? List.of() : List.copyOf(dropped);
    }

    public static AssembledContext empty(int budgetChars) {
        return new AssembledContext(List.of(), List.of(), budgetChars, 0);
    }

    public boolean isEmpty() {
        return this.hits.isEmpty();
    }

    public long droppedCount(DropReason reason) {
        return this.dropped.stream().filter(d -> d.reason() == reason).count();
    }
}
