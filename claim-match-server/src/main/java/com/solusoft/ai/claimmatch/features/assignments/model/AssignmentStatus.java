package com.solusoft.ai.claimmatch.features.assignments.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of a document-claim assignment.
 * CANDIDATE is created by matching; CONFIRMED and REJECTED are set by a reviewer and are final.
 */
public enum AssignmentStatus {
    CANDIDATE("candidate"),
    CONFIRMED("confirmed"),
    REJECTED("rejected");

    private final String value;

    AssignmentStatus(String value) {
        this.value = value;
    }

    public boolean canTransitionTo(AssignmentStatus target) {
        return switch (this) {
            case CANDIDATE -> target == CONFIRMED || target == REJECTED;
            case CONFIRMED, REJECTED -> false;
        };
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AssignmentStatus fromValue(String value) {
        for (AssignmentStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown assignment status: " + value);
    }
}
