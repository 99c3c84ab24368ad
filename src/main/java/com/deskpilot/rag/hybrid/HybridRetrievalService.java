package com.deskpilot.rag.hybrid;

import com.deskpilot.embedding.EmbeddingClient;
import com.deskpilot.model.QueryOptions;
import com.deskpilot.model.RetrievalHit;
import com.deskpilot.model.StructuredRecord;
import com.deskpilot.rag.hybrid.RetrievalResult.SourceStatus;
import com.deskpilot.rag.structured.KeywordRelevanceScorer;
import com.deskpilot.rag.structured.StructuredSearchAdapter;
import com.deskpilot.util.KeywordExtractor;
import com.deskpilot.util.LogSanitizer;
import com.deskpilot.vector.IndexUnavailableException;
import com.deskpilot.vector.VectorIndex;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs vector and structured retrieval concurrently under one overall deadline. A path
 * that fails or misses the deadline contributes no hits; the query only fails when
 * no requested path produced a result.
 *
 * <p>Interrupting the query thread cancels both paths. Each path runs as a plain
 * {@link Future} so cancellation interrupts its worker, which in turn cancels the
 * embedding call it is waiting on.</p>
 */
@Service
public class HybridRetrievalService {
    private static final Logger log = LoggerFactory.getLogger(HybridRetrievalService.class);
    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final StructuredSearchAdapter structuredSearch;
    private final KeywordRelevanceScorer scorer;
    private final ExecutorService ragExecutor;

    @Value("${deskpilot.retrieval.vector-top-k:5}")
    private int vectorTopK = 5;

    @Value("${deskpilot.retrieval.structured-limit:5}")
    private int structuredLimit = 5;

    @Value("${deskpilot.retrieval.timeout-millis:5000}")
    private long timeoutMillis = 5000L;

    public HybridRetrievalService(EmbeddingClient embeddingClient, VectorIndex vectorIndex, StructuredSearchAdapter structuredSearch,
                                  KeywordRelevanceScorer scorer, @Qualifier("ragExecutor") ExecutorService ragExecutor) {
        this.embeddingClient = embeddingClient;
        this.vectorIndex = vectorIndex;
        this.structuredSearch = structuredSearch;
        this.scorer = scorer;
        this.ragExecutor = ragExecutor;
    }

    public RetrievalResult retrieve(String question) {
        return this.retrieve(question, QueryOptions.DEFAULT);
    }

    /**
     * @throws IndexUnavailableException when every requested retrieval path fails or times out
     */
    public RetrievalResult retrieve(String question, QueryOptions options) {
        if (question == null || question.isBlank()) {
            return RetrievalResult.empty();
        }
        QueryOptions effective = options != null ? options : QueryOptions.DEFAULT;
        long startTime = System.currentTimeMillis();
        Future<List<RetrievalHit>> vectorFuture = this.submit("vector", () -> this.vectorSearch(question));
        Future<List<RetrievalHit>> structuredFuture = effective.includesStructured()
                ? this.submit("structured", () -> this.structuredSearch(question, effective))
                : null;
        long deadline = startTime + this.timeoutMillis;

        Outcome vector = this.await("vector", vectorFuture, deadline);
        Outcome structured;
        if (structuredFuture == null) {
            structured = new Outcome(List.of(), SourceStatus.SKIPPED, null);
        } else if (vector.status() == SourceStatus.CANCELLED) {
            structured = cancel(structuredFuture);
        } else {
            structured = this.await("structured", structuredFuture, deadline);
        }
        long elapsed = System.currentTimeMillis() - startTime;

        if (!vector.status().succeeded() && !structured.status().succeeded()
                && vector.status() != SourceStatus.CANCELLED && structured.status() != SourceStatus.CANCELLED) {
            IndexUnavailableException failure = new IndexUnavailableException("No retrieval source available (vector="
                    + vector.status() + ", structured=" + structured.status() + ")");
            addCause(failure, vector.error());
            addCause(failure, structured.error());
            throw failure;
        }
        log.info("Hybrid retrieval for {}: vector={} ({} hits), structured={} ({} hits) in {}ms",
                LogSanitizer.querySummary(question), vector.status(), vector.hits().size(),
                structured.status(), structured.hits().size(), elapsed);
        return new RetrievalResult(vector.hits(), structured.hits(), vector.status(), structured.status(), elapsed);
    }

    private List<RetrievalHit> vectorSearch(String question) {
        float[] queryVector = this.embeddingClient.embedQuery(question);
        return this.vectorIndex.search(queryVector, this.vectorTopK, this.embeddingClient.modelId());
    }

    private List<RetrievalHit> structuredSearch(String question, QueryOptions options) {
        Set<String> keywords = KeywordExtractor.extract(question);
        List<StructuredRecord> records = this.structuredSearch.searchRelevant(question, this.structuredLimit, options);
        return records.stream()
                .filter(record -> options.matchesCategory(record.category()))
                .map(record -> RetrievalHit.fromRecord(record, this.scorer.score(keywords, record)))
                .sorted(Comparator.comparingDouble(RetrievalHit::score).reversed())
                .limit(this.structuredLimit)
                .collect(Collectors.toList());
    }

    private Future<List<RetrievalHit>> submit(String source, Callable<List<RetrievalHit>> task) {
        try {
            return this.ragExecutor.submit(task);
        }
        catch (RejectedExecutionException e) {
            log.warn("RAG thread pool overloaded; {} retrieval not started: {}", source, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    private Outcome await(String source, Future<List<RetrievalHit>> future, long deadline) {
        long remainingMs = deadline - System.currentTimeMillis();
        try {
            if (remainingMs <= 0L && !future.isDone()) {
                throw new TimeoutException();
            }
            List<RetrievalHit> hits = future.get(Math.max(0L, remainingMs), TimeUnit.MILLISECONDS);
            return new Outcome(hits != null ? hits : List.of(), SourceStatus.OK, null);
        }
        catch (TimeoutException e) {
            log.warn("{} retrieval exceeded the {}ms deadline; continuing without it", source, this.timeoutMillis);
            future.cancel(true);
            return new Outcome(List.of(), SourceStatus.TIMED_OUT, e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} retrieval interrupted", source);
            future.cancel(true);
            return new Outcome(List.of(), SourceStatus.CANCELLED, e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} retrieval failed: {}", source, cause.getMessage());
            return new Outcome(List.of(), SourceStatus.FAILED, cause);
        }
        catch (CancellationException e) {
            return new Outcome(List.of(), SourceStatus.CANCELLED, e);
        }
    }

    private static Outcome cancel(Future<List<RetrievalHit>> future) {
        future.cancel(true);
        return new Outcome(List.of(), SourceStatus.CANCELLED, null);
    }

    private static void addCause(IndexUnavailableException failure, Throwable error) {
        if (error == null) {
            return;
        }
        if (failure.getCause() == null) {
            failure.initCause(error);
        } else {
            failure.addSuppressed(error);
        }
    }

    private record Outcome(List<RetrievalHit> hits, SourceStatus status, Throwable error) {
    }
}
