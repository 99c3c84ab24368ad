package com.deskpilot.util;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

/**
 * Classifies failures of remote model calls. Transient: I/O, timeouts, HTTP 5xx and 429,
 * {@link TransientAiException}. Everything else is permanent.
 */
public final class TransientErrors {
    private static final int MAX_CAUSE_DEPTH = 8;

    private TransientErrors() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof NonTransientAiException) {
                return false;
            }
            if (current instanceof TransientAiException || current instanceof ResourceAccessException
                    || current instanceof HttpServerErrorException || current instanceof HttpClientErrorException.TooManyRequests
                    || current instanceof IOException || current instanceof TimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
