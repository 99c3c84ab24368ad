package com.deskpilot.util;

import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.NoBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Builds the {@link RetryTemplate}s used for remote model calls: a bounded number of
 * attempts with exponential backoff, retrying only failures the {@code retryable}
 * predicate accepts. Anything else is rethrown on the first attempt.
 */
public final class RetryTemplates {
    private static final Logger log = LoggerFactory.getLogger(RetryTemplates.class);
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final long MAX_BACKOFF_MILLIS = 10_000L;

    private RetryTemplates() {
    }

    public static RetryTemplate transientOnly(String operation, int maxRetries, long backoffMillis, Predicate<Throwable> retryable) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new PredicateRetryPolicy(Math.max(0, maxRetries) + 1, retryable));
        if (backoffMillis > 0L) {
            ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
            backOff.setInitialInterval(backoffMillis);
            backOff.setMultiplier(BACKOFF_MULTIPLIER);
            backOff.setMaxInterval(Math.max(backoffMillis, MAX_BACKOFF_MILLIS));
            template.setBackOffPolicy(backOff);
        } else {
            template.setBackOffPolicy(new NoBackOffPolicy());
        }
        template.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
                if (retryable.test(throwable) && context.getRetryCount() <= maxRetries) {
                    log.warn("{} failed (attempt {}/{}): {}", operation, context.getRetryCount(), maxRetries + 1, throwable.getMessage());
                }
            }
        });
        return template;
    }

    static final class PredicateRetryPolicy extends SimpleRetryPolicy {
        private final Predicate<Throwable> retryable;

        PredicateRetryPolicy(int maxAttempts, Predicate<Throwable> retryable) {
            super(maxAttempts);
            this.retryable = retryable;
        }

        @Override
        public boolean canRetry(RetryContext context) {
            Throwable last = context.getLastThrowable();
            return (last == null || this.retryable.test(last)) && context.getRetryCount() < this.getMaxAttempts();
        }
    }
}
