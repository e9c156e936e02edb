package com.solusoft.ai.claimmatch.features.documents.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentClassification {
    MEDICAL_BILL("medical_bill"),
    CORRESPONDENCE("correspondence"),
    RECEIPT("receipt"),
    PRESCRIPTION("prescription"),
    LAB_RESULT("lab_result"),
    INSURANCE_STATEMENT("insurance_statement"),
    APPOINTMENT("appointment"),
    UNKNOWN("unknown");

    private final String value;

    DocumentClassification(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    // Tags written by newer classifiers fall back to UNKNOWN instead of failing the whole read
    @JsonCreator
    public static DocumentClassification fromValue(String value) {
        for (DocumentClassification classification : values()) {
            if (classification.value.equalsIgnoreCase(value)) {
                return classification;
            }
        }
        return UNKNOWN;
    }
}
