package com.solusoft.ai.claimmatch.exception;

/**
 * Base type for failures the review workflow reports back to the caller.
 */
public abstract class ClaimMatchException extends RuntimeException {

    protected ClaimMatchException(String message) {
        super(message);
    }

    protected ClaimMatchException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Status code used in tool responses (e.g. NOT_FOUND).
     */
    public abstract String getErrorCode();
}
