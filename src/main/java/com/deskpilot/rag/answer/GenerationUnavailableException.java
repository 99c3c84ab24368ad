package com.deskpilot.rag.answer;

public class GenerationUnavailableException extends RuntimeException {
    private final boolean transientFailure;

    public GenerationUnavailableException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public GenerationUnavailableException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return this.transientFailure;
    }
}
