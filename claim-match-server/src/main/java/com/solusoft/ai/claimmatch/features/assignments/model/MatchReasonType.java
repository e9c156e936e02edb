package com.solusoft.ai.claimmatch.features.assignments.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchReasonType {
    EXACT_AMOUNT("exact_amount"),
    APPROXIMATE_AMOUNT("approximate_amount"),
    DATE_PROXIMITY("date_proximity"),
    PROVIDER_MATCH("provider_match"),
    MANUAL("manual");

    private final String value;

    MatchReasonType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static MatchReasonType fromValue(String value) {
        for (MatchReasonType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown match reason type: " + value);
    }
}
