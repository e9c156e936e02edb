package com.solusoft.ai.claimmatch.exception;

import lombok.Getter;

/**
 * Unexpected failure while scoring one document against one claim.
 * Aborts the matching call it happened in.
 */
@Getter
public class MatchingException extends ClaimMatchException {

    private final String documentId;
    private final String claimId;

    public MatchingException(String documentId, String claimId, Throwable cause) {
        super("Scoring failed for document " + documentId + " against claim " + claimId + ": " + cause.getMessage(), cause);
        this.documentId = documentId;
        this.claimId = claimId;
    }

    @Override
    public String getErrorCode() {
        return "FATAL_ERROR";
    }
}
