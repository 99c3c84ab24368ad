package com.deskpilot.rag.assembly;

import com.deskpilot.model.AssembledContext;
import com.deskpilot.model.DropReason;
import com.deskpilot.model.DroppedHit;
import com.deskpilot.model.HitSource;
import com.deskpilot.model.RetrievalHit;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Merges vector and structured hits into one ranked, de-duplicated list that fits a
 * character budget.
 *
 * <p>Ranking is by descending score. Equal scores put structured hits before vector hits,
 * then the more recently updated hit first (unknown dates last), then input order. A hit
 * that repeats a higher-ranked passage of the same source is dropped as
 * {@link DropReason#DUPLICATE}. The budget walk stops at the first hit that does not fit:
 * that hit and every later one are dropped as {@link DropReason#BUDGET}.</p>
 */
@Component
public class ContextAssembler {
    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private static final Comparator<Ranked> RANKING = Comparator
            .comparingDouble((Ranked r) -> r.hit().score()).reversed()
            .thenComparing(r -> r.hit().source() == HitSource.STRUCTURED ? 0 : 1)
            .thenComparing(r -> r.hit().updatedAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparingInt(Ranked::inputOrder);

    @Value("${deskpilot.context.budget-chars:6000}")
    private int defaultBudgetChars = 6000;

    public AssembledContext assemble(List<RetrievalHit> vectorHits, List<RetrievalHit> structuredHits) {
        return this.assemble(vectorHits, structuredHits, this.defaultBudgetChars);
    }

    public AssembledContext assemble(List<RetrievalHit> vectorHits, List<RetrievalHit> structuredHits, int budgetChars) {
        if (budgetChars < 0) {
            throw new IllegalArgumentException("budgetChars must not be negative: " + budgetChars);
        }
        List<Ranked> ranked = rank(vectorHits, structuredHits);
        if (ranked.isEmpty()) {
            return AssembledContext.empty(budgetChars);
        }
        ArrayList<RetrievalHit> unique = new ArrayList<>();
        ArrayList<DroppedHit> dropped = new ArrayList<>();
        for (Ranked candidate : ranked) {
            RetrievalHit hit = candidate.hit();
            if (unique.stream().anyMatch(kept -> isDuplicate(kept, hit))) {
                dropped.add(new DroppedHit(hit, DropReason.DUPLICATE));
            } else {
                unique.add(hit);
            }
        }
        ArrayList<RetrievalHit> kept = new ArrayList<>();
        int used = 0;
        boolean exhausted = false;
        for (RetrievalHit hit : unique) {
            if (!exhausted && used + hit.text().length() <= budgetChars) {
                kept.add(hit);
                used += hit.text().length();
            } else {
                exhausted = true;
                dropped.add(new DroppedHit(hit, DropReason.BUDGET));
            }
        }
        log.debug("Assembled context: {} hits kept ({} / {} chars), {} duplicates, {} over budget", kept.size(), used, budgetChars,
                dropped.stream().filter(d -> d.reason() == DropReason.DUPLICATE).count(),
                dropped.stream().filter(d -> d.reason() == DropReason.BUDGET).count());
        return new AssembledContext(kept, dropped, budgetChars, used);
    }

    public int getDefaultBudgetChars() {
        return this.defaultBudgetChars;
    }

    private static List<Ranked> rank(List<RetrievalHit> vectorHits, List<RetrievalHit> structuredHits) {
        ArrayList<Ranked> ranked = new ArrayList<>();
        int order = 0;
        for (List<RetrievalHit> hits : List.of(nullSafe(vectorHits), nullSafe(structuredHits))) {
            for (RetrievalHit hit : hits) {
                if (hit != null && !hit.text().isBlank()) {
                    ranked.add(new Ranked(hit, order++));
                }
            }
        }
        ranked.sort(RANKING);
        return ranked;
    }

    static boolean isDuplicate(RetrievalHit kept, RetrievalHit candidate) {
        if (!kept.provenanceId().equals(candidate.provenanceId())) {
            return false;
        }
        if (kept.hasOffsets() && candidate.hasOffsets() && sameLabel(kept, candidate)) {
            return kept.startOffset() < candidate.endOffset() && candidate.startOffset() < kept.endOffset();
        }
        String a = normalize(kept.text());
        String b = normalize(candidate.text());
        return a.equals(b) || a.contains(b) || b.contains(a);
    }

    private static boolean sameLabel(RetrievalHit a, RetrievalHit b) {
        return a.label() == null ? b.label() == null : a.label().equals(b.label());
    }

    private static String normalize(String text) {
        return text.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }

    private static List<RetrievalHit> nullSafe(List<RetrievalHit> hits) {
        return hits == null ? List.of() : hits;
    }

    private record Ranked(RetrievalHit hit, int inputOrder) {
    }
}
