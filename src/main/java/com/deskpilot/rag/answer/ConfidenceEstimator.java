package com.deskpilot.rag.answer;

import com.deskpilot.model.RetrievalHit;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * confidence = 0.5 * mean context score + 0.3 * min(1, hits / 3) + 0.2 * mean extraction
 * confidence of the cited hits, scaled by {@value #UNCERTAINTY_PENALTY} when the answer
 * admits it could not answer.
 */
@Component
public class ConfidenceEstimator {
    static final double SCORE_WEIGHT = 0.5;
    static final double COVERAGE_WEIGHT = 0.3;
    static final double EXTRACTION_WEIGHT = 0.2;
    static final double UNCERTAINTY_PENALTY = 0.25;
    private static final int FULL_COVERAGE_HITS = 3;
    private static final List<String> UNCERTAINTY_MARKERS = List.of(
            PromptBuilder.INSUFFICIENT_CONTEXT.toLowerCase(Locale.ROOT),
            "insufficient information", "not enough information", "i don't know", "i do not know", "cannot answer");

    public double estimate(List<RetrievalHit> contextHits, List<RetrievalHit> citedHits, String answer) {
        if (contextHits == null || contextHits.isEmpty()) {
            return 0.0;
        }
        double avgScore = contextHits.stream().mapToDouble(RetrievalHit::score).average().orElse(0.0);
        double coverage = Math.min(1.0, contextHits.size() / (double) FULL_COVERAGE_HITS);
        List<RetrievalHit> cited = citedHits == null || citedHits.isEmpty() ? contextHits : citedHits;
        double extraction = cited.stream().mapToDouble(RetrievalHit::extractionConfidence).average().orElse(1.0);
        double confidence = SCORE_WEIGHT * avgScore + COVERAGE_WEIGHT * coverage + EXTRACTION_WEIGHT * extraction;
        if (signalsUncertainty(answer)) {
            confidence *= UNCERTAINTY_PENALTY;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    public static boolean signalsUncertainty(String answer) {
        if (answer == null || answer.isBlank()) {
            return true;
        }
        String lower = answer.toLowerCase(Locale.ROOT).replace('\u2019', '\'');
        return UNCERTAINTY_MARKERS.stream().anyMatch(lower::contains);
    }
}
