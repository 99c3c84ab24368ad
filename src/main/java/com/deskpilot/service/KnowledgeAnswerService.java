package com.deskpilot.service;

import com.deskpilot.model.AnswerResult;
import com.deskpilot.model.AssembledContext;
import com.deskpilot.model.QueryOptions;
import com.deskpilot.rag.answer.AnswerSynthesizer;
import com.deskpilot.rag.assembly.ContextAssembler;
import com.deskpilot.rag.hybrid.HybridRetrievalService;
import com.deskpilot.rag.hybrid.RetrievalResult;
import com.deskpilot.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Query entry point: hybrid retrieval, context assembly, answer synthesis.
 */
@Service
public class KnowledgeAnswerService {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeAnswerService.class);
    private final HybridRetrievalService retrievalService;
    private final ContextAssembler contextAssembler;
    private final AnswerSynthesizer answerSynthesizer;

    public KnowledgeAnswerService(HybridRetrievalService retrievalService, ContextAssembler contextAssembler, AnswerSynthesizer answerSynthesizer) {
        this.retrievalService = retrievalService;
        this.contextAssembler = contextAssembler;
        this.answerSynthesizer = answerSynthesizer;
    }

    public AnswerResult answer(String question) {
        return this.answer(question, QueryOptions.DEFAULT);
    }

    /**
     * @param options which structured record kinds to consult and an optional category filter
     * @throws com.deskpilot.vector.IndexUnavailableException when no retrieval source is reachable
     */
    public AnswerResult answer(String question, QueryOptions options) {
        if (question == null || question.isBlank()) {
            return this.answerSynthesizer.synthesize("", AssembledContext.empty(this.contextAssembler.getDefaultBudgetChars()));
        }
        long start = System.currentTimeMillis();
        RetrievalResult retrieved = this.retrievalService.retrieve(question, options);
        AssembledContext context = this.contextAssembler.assemble(retrieved.vectorHits(), retrieved.structuredHits());
        AnswerResult result = this.answerSynthesizer.synthesize(question, context);
        log.info("Query {} -> {} (retrieved={}, kept={}, partial={}) in {}ms", LogSanitizer.querySummary(question),
                result.outcome(), retrieved.totalHits(), context.hits().size(), retrieved.isPartial(), System.currentTimeMillis() - start);
        return result;
    }
}
