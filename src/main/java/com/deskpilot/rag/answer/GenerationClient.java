package com.deskpilot.rag.answer;

import com.deskpilot.util.RetryTemplates;
import com.deskpilot.util.SimpleCircuitBreaker;
import com.deskpilot.util.TransientErrors;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Calls the chat model with a timeout, bounded retries for transient failures and a
 * circuit breaker that fails fast while the model is known to be down. Interrupting the
 * caller cancels the in-flight model call.
 */
@Service
public class GenerationClient {
    private static final Logger log = LoggerFactory.getLogger(GenerationClient.class);
    private final ChatModel chatModel;
    private final ExecutorService executor;

    @Value("${deskpilot.generation.timeout-seconds:60}")
    private int timeoutSeconds = 60;

    @Value("${deskpilot.generation.max-retries:2}")
    private int maxRetries = 2;

    @Value("${deskpilot.generation.backoff-millis:500}")
    private long backoffMillis = 500L;

    @Value("${deskpilot.generation.breaker.failure-threshold:5}")
    private int breakerFailureThreshold = 5;

    @Value("${deskpilot.generation.breaker.open-seconds:30}")
    private int breakerOpenSeconds = 30;

    private RetryTemplate retryTemplate;
    private SimpleCircuitBreaker circuitBreaker;

    public GenerationClient(ChatModel chatModel, @Qualifier("modelExecutor") ExecutorService executor) {
        this.chatModel = chatModel;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        this.retryTemplate = RetryTemplates.transientOnly("Generation", this.maxRetries, this.backoffMillis,
                e -> e instanceof GenerationUnavailableException gue && gue.isTransient());
        this.circuitBreaker = new SimpleCircuitBreaker("generation", this.breakerFailureThreshold,
                Duration.ofSeconds(this.breakerOpenSeconds), 1);
        log.info("Generation client initialized (timeout={}s, maxRetries={})", this.timeoutSeconds, this.maxRetries);
    }

    /**
     * @throws GenerationUnavailableException when the model times out, keeps failing or the circuit is open
     */
    public String generate(String prompt) {
        if (this.circuitBreaker == null) {
            this.init();
        }
        if (!this.circuitBreaker.allowRequest()) {
            throw new GenerationUnavailableException("Generation circuit is open; model considered unavailable", false);
        }
        try {
            String text = this.retryTemplate.execute(context -> this.generateOnce(prompt));
            this.circuitBreaker.recordSuccess();
            return text;
        }
        catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationUnavailableException("Generation interrupted while backing off", false, e);
        }
        catch (GenerationUnavailableException e) {
            // a cancelled query says nothing about the model's health
            if (!Thread.currentThread().isInterrupted()) {
                this.circuitBreaker.recordFailure(e);
            }
            throw e;
        }
    }

    public SimpleCircuitBreaker.State circuitState() {
        return this.circuitBreaker == null ? SimpleCircuitBreaker.State.CLOSED : this.circuitBreaker.getState();
    }

    private String generateOnce(String prompt) {
        if (Thread.currentThread().isInterrupted()) {
            throw new GenerationUnavailableException("Generation interrupted", false);
        }
        Future<String> future;
        try {
            future = this.executor.submit(() -> this.call(prompt));
        }
        catch (RejectedExecutionException e) {
            throw new GenerationUnavailableException("Generation executor saturated", true, e);
        }
        String text;
        try {
            text = future.get(this.timeoutSeconds, TimeUnit.SECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            throw new GenerationUnavailableException("Generation timed out after " + this.timeoutSeconds + "s", true, e);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GenerationUnavailableException("Generation interrupted", false, e);
        }
        catch (CancellationException e) {
            throw new GenerationUnavailableException("Generation cancelled", false, e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new GenerationUnavailableException("Generation failed: " + cause.getMessage(), TransientErrors.isTransient(cause), cause);
        }
        if (text == null || text.isBlank()) {
            throw new GenerationUnavailableException("Chat model returned an empty answer", false);
        }
        return text.trim();
    }

    private String call(String prompt) {
        ChatResponse response = this.chatModel.call(new Prompt(prompt));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return null;
        }
        return response.getResult().getOutput().getText();
    }
}
