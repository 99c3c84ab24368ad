package com.deskpilot.embedding;

import com.deskpilot.util.RetryTemplates;
import com.deskpilot.util.TransientErrors;
import com.github.benmanes.caffeine.cache.Cache;
import jakarta.annotation.PostConstruct;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Embeds passages and queries with the configured model. Every call runs with a timeout
 * and transient failures are retried a bounded number of times; the returned vectors are
 * tagged with {@link #modelId()} by callers so vectors of different models never meet.
 *
 * <p>Interrupting the calling thread cancels the in-flight model call and interrupts the
 * worker running it.</p>
 */
@Service
public class EmbeddingClient {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingClient.class);

    private final EmbeddingModel embeddingModel;
    private final ExecutorService executor;
    private final Cache<String, float[]> queryEmbeddingCache;

    @Value("${deskpilot.embedding.model-id:nomic-embed-text}")
    private String modelId = "nomic-embed-text";

    @Value("${deskpilot.embedding.timeout-seconds:30}")
    private int timeoutSeconds = 30;

    @Value("${deskpilot.embedding.max-retries:2}")
    private int maxRetries = 2;

    @Value("${deskpilot.embedding.backoff-millis:200}")
    private long backoffMillis = 200L;

    @Value("${deskpilot.embedding.max-input-chars:8000}")
    private int maxInputChars = 8000;

    private RetryTemplate retryTemplate;

    public EmbeddingClient(EmbeddingModel embeddingModel, @Qualifier("modelExecutor") ExecutorService executor,
                           @Qualifier("queryEmbeddingCache") Cache<String, float[]> queryEmbeddingCache) {
        this.embeddingModel = embeddingModel;
        this.executor = executor;
        this.queryEmbeddingCache = queryEmbeddingCache;
    }

    @PostConstruct
    public void init() {
        this.retryTemplate = RetryTemplates.transientOnly("Embedding[" + this.modelId + "]", this.maxRetries,
                this.backoffMillis, e -> e instanceof EmbeddingException ee && ee.isTransient());
        log.info("Embedding client initialized (model={}, timeout={}s, maxRetries={})", this.modelId, this.timeoutSeconds, this.maxRetries);
    }

    public String modelId() {
        return this.modelId;
    }

    /**
     * Embeds a passage for indexing.
     *
     * @throws EmbeddingException when the text is rejected or the model keeps failing
     */
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed blank text", false);
        }
        if (text.length() > this.maxInputChars) {
            throw new EmbeddingException("Text of " + text.length() + " chars exceeds embedding limit of " + this.maxInputChars, false);
        }
        try {
            return this.retryTemplate().execute(context -> this.embedOnce(text));
        }
        catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Embedding interrupted while backing off", false, e);
        }
    }

    /**
     * Embeds a question. Results are cached per model and text since embeddings are deterministic.
     */
    public float[] embedQuery(String question) {
        String key = this.modelId + "\u0000" + question;
        float[] cached = this.queryEmbeddingCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        float[] vector = this.embed(question);
        this.queryEmbeddingCache.put(key, vector);
        return vector;
    }

    private float[] embedOnce(String text) {
        if (Thread.currentThread().isInterrupted()) {
            throw new EmbeddingException("Embedding interrupted", false);
        }
        Future<float[]> future;
        try {
            future = this.executor.submit(() -> this.embeddingModel.embed(text));
        }
        catch (RejectedExecutionException e) {
            throw new EmbeddingException("Embedding executor saturated", true, e);
        }
        float[] vector;
        try {
            vector = future.get(this.timeoutSeconds, TimeUnit.SECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            throw new EmbeddingException("Embedding timed out after " + this.timeoutSeconds + "s", true, e);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Embedding interrupted", false, e);
        }
        catch (CancellationException e) {
            throw new EmbeddingException("Embedding cancelled", false, e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new EmbeddingException("Embedding failed: " + cause.getMessage(), TransientErrors.isTransient(cause), cause);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding model returned an empty vector", false);
        }
        return vector;
    }

    private RetryTemplate retryTemplate() {
        if (this.retryTemplate == null) {
            this.init();
        }
        return this.retryTemplate;
    }
}
