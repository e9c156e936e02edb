package com.solusoft.ai.claimmatch.features.drafts.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of a draft claim.
 * PENDING moves to ACCEPTED; ACCEPTED and REJECTED can be re-opened to PENDING.
 * Rejecting is allowed from every state.
 */
public enum DraftClaimStatus {
    PENDING("pending"),
    ACCEPTED("accepted"),
    REJECTED("rejected");

    private final String value;

    DraftClaimStatus(String value) {
        this.value = value;
    }

    public boolean canTransitionTo(DraftClaimStatus target) {
        return switch (this) {
            case PENDING -> target == ACCEPTED || target == REJECTED;
            case ACCEPTED, REJECTED -> target == PENDING || target == REJECTED;
        };
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DraftClaimStatus fromValue(String value) {
        for (DraftClaimStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown draft claim status: " + value);
    }
}
