package com.solusoft.ai.claimmatch.features.drafts.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TreatmentDateSource {
    MANUAL("manual"),
    CALENDAR("calendar");

    private final String value;

    TreatmentDateSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TreatmentDateSource fromValue(String value) {
        for (TreatmentDateSource source : values()) {
            if (source.value.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown treatment date source: " + value);
    }
}
