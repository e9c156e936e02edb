package com.solusoft.ai.claimmatch.features.illnesses.model;

import java.time.Instant;
import java.util.List;

import lombok.Builder;

@Builder(toBuilder = true)
public record Illness(
    String id,
    String patientId,
    String name,
    String icdCode,
    List<RelevantAccount> relevantAccounts,
    Instant createdAt,
    Instant updatedAt
) {

    public Illness {
        relevantAccounts = relevantAccounts == null ? List.of() : List.copyOf(relevantAccounts);
    }
}
