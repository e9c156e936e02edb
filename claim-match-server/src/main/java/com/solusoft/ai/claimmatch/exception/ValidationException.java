package com.solusoft.ai.claimmatch.exception;

/**
 * Reviewer input that cannot be applied. Raised before anything is written.
 */
public class ValidationException extends ClaimMatchException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_INPUT";
    }
}
