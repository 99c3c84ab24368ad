package com.deskpilot.rag.answer;

import com.deskpilot.model.AnswerOutcome;
import com.deskpilot.model.AnswerResult;
import com.deskpilot.model.AssembledContext;
import com.deskpilot.model.RetrievalHit;
import com.deskpilot.util.LogSanitizer;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns an assembled context into a cited answer. An empty context never reaches the
 * model; a failing model yields a zero-confidence fallback that still lists the sources.
 */
@Service
public class AnswerSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesizer.class);
    public static final String NO_INFORMATION_ANSWER = "No information found in the knowledge base for this question.";
    public static final String GENERATION_FAILED_ANSWER = "The answer could not be generated right now. The sources listed below may still help.";

    private final GenerationClient generationClient;
    private final ConfidenceEstimator confidenceEstimator;
    private final AnswerSuggestionService suggestionService;

    public AnswerSynthesizer(GenerationClient generationClient, ConfidenceEstimator confidenceEstimator, AnswerSuggestionService suggestionService) {
        this.generationClient = generationClient;
        this.confidenceEstimator = confidenceEstimator;
        this.suggestionService = suggestionService;
    }

    public AnswerResult synthesize(String question, AssembledContext context) {
        String normalized = question == null ? "" : question.trim();
        if (normalized.isEmpty() || context == null || context.isEmpty()) {
            return noInformation(normalized, List.of(), 0.0);
        }
        List<RetrievalHit> hits = context.hits();
        String prompt = PromptBuilder.build(normalized, context);
        String answer;
        try {
            answer = this.generationClient.generate(prompt);
        }
        catch (GenerationUnavailableException e) {
            log.warn("Generation failed for {}: {}", LogSanitizer.querySummary(normalized), e.getMessage());
            return new AnswerResult(normalized, GENERATION_FAILED_ANSWER, hits, 0.0,
                    this.suggestionService.suggestedActions(normalized, hits),
                    this.suggestionService.suggestCategory(normalized, hits).orElse(null),
                    AnswerOutcome.GENERATION_FAILED);
        }
        List<RetrievalHit> cited = citedHits(answer, hits);
        double confidence = this.confidenceEstimator.estimate(hits, cited, answer);
        if (PromptBuilder.INSUFFICIENT_CONTEXT.equals(answer.trim())) {
            log.info("Model reported insufficient context for {}", LogSanitizer.querySummary(normalized));
            return noInformation(normalized, cited, confidence);
        }
        log.info("Answered {} with {} cited sources (confidence {})", LogSanitizer.querySummary(normalized), cited.size(),
                String.format("%.2f", confidence));
        return new AnswerResult(normalized, answer, cited, confidence,
                this.suggestionService.suggestedActions(normalized, cited),
                this.suggestionService.suggestCategory(normalized, cited).orElse(null),
                AnswerOutcome.ANSWERED);
    }

    static List<RetrievalHit> citedHits(String answer, List<RetrievalHit> hits) {
        List<Integer> indexes = PromptBuilder.citedIndexes(answer, hits.size());
        if (indexes.isEmpty()) {
            return hits;
        }
        ArrayList<RetrievalHit> cited = new ArrayList<>(indexes.size());
        for (int index : indexes) {
            cited.add(hits.get(index));
        }
        return cited;
    }

    private static AnswerResult noInformation(String question, List<RetrievalHit> sources, double confidence) {
        return new AnswerResult(question, NO_INFORMATION_ANSWER, sources, confidence, List.of(), null, AnswerOutcome.NO_INFORMATION);
    }
}
