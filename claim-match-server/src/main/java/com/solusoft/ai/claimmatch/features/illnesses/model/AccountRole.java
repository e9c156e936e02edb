package com.solusoft.ai.claimmatch.features.illnesses.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AccountRole {
    PROVIDER("provider"),
    PHARMACY("pharmacy"),
    LAB("lab"),
    INSURANCE("insurance"),
    OTHER("other");

    private final String value;

    AccountRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AccountRole fromValue(String value) {
        for (AccountRole role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return role;
            }
        }
        return OTHER;
    }
}
