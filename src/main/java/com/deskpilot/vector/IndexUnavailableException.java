package com.deskpilot.vector;

/**
 * The vector index (or, for a query, every retrieval source) could not be reached.
 */
public class IndexUnavailableException extends RuntimeException {

    public IndexUnavailableException(String message) {
        super(message);
    }

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
