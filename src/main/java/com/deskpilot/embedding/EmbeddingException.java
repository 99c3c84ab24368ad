package com.deskpilot.embedding;

public class EmbeddingException extends RuntimeException {
    private final boolean transientFailure;

    public EmbeddingException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public EmbeddingException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * Transient failures (timeouts, I/O, overloaded backend) may be retried; permanent ones
     * (input too long, malformed response) must not be.
     */
    public boolean isTransient() {
        return this.transientFailure;
    }
}
