package com.solusoft.ai.claimmatch.features.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentSignalSource {
    DETECTED("detected", 1),
    OVERRIDE("override", 2);

    private final String value;
    private final int priority;

    PaymentSignalSource(String value, int priority) {
        this.value = value;
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PaymentSignalSource fromValue(String value) {
        for (PaymentSignalSource source : values()) {
            if (source.value.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown payment signal source: " + value);
    }
}
