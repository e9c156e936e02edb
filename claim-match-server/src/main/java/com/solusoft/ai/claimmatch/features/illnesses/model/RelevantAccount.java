package com.solusoft.ai.claimmatch.features.illnesses.model;

import java.time.Instant;

import lombok.Builder;

/**
 * Contact (provider, pharmacy, lab, insurer) linked to an illness through confirmed evidence.
 */
@Builder
public record RelevantAccount(
    String email,
    String name,
    AccountRole role,
    Instant addedAt,
    String sourceDocumentId
) {}
