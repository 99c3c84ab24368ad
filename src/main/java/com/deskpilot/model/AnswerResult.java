package com.deskpilot.model;

import java.util.List;

/**
 * Request-scoped answer payload. Never persisted by this service.
 */
public record AnswerResult(
        String question,
        String answer,
        List<RetrievalHit> sources,
        double confidence,
        List<String> suggestedActions,
        String suggestedCategory,
        AnswerOutcome outcome) {

    public AnswerResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
    }
}
