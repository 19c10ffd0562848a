package com.poolpulse.indexer.util;

/**
 * Raised when every attempt of a {@link RetryPolicy} failed.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable cause) {
        super(operation + " failed after " + attempts + " attempt(s)"
                + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
