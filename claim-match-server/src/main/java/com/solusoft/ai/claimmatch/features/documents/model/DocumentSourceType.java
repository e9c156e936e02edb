package com.solusoft.ai.claimmatch.features.documents.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a document was ingested from.
 */
public enum DocumentSourceType {
    EMAIL("email"),
    ATTACHMENT("attachment"),
    CALENDAR("calendar");

    private final String value;

    DocumentSourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DocumentSourceType fromValue(String value) {
        for (DocumentSourceType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown document source type: " + value);
    }
}
