package com.solusoft.ai.claimmatch.features.drafts.model;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Document date window used when generating draft claims.
 */
public enum DraftClaimRange {
    FOREVER("forever", 0),
    LAST_MONTH("last_month", 30),
    LAST_WEEK("last_week", 7);

    private final String value;
    private final int days;

    DraftClaimRange(String value, int days) {
        this.value = value;
        this.days = days;
    }

    /**
     * FOREVER accepts everything, including undated documents.
     * Bounded ranges require a date inside {@code [now - days, now]}.
     */
    public boolean contains(Instant documentDate, Instant now) {
        if (this == FOREVER) {
            return true;
        }
        if (documentDate == null) {
            return false;
        }
        Instant start = now.minus(Duration.ofDays(days));
        return !documentDate.isBefore(start) && !documentDate.isAfter(now);
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DraftClaimRange fromValue(String value) {
        for (DraftClaimRange range : values()) {
            if (range.value.equalsIgnoreCase(value)) {
                return range;
            }
        }
        throw new IllegalArgumentException("Unknown draft claim range: " + value);
    }
}
