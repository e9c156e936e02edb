package com.solusoft.ai.claimmatch.features.claims.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import lombok.Builder;

/**
 * Claim record as imported from the insurer portal.
 */
@Builder(toBuilder = true)
public record InsurerClaim(
    String id,
    String claimNumber,
    String submissionNumber,
    String memberName,
    BigDecimal claimAmount,
    String claimCurrency,
    LocalDate treatmentDate,
    LocalDate submissionDate,
    List<ClaimLineItem> lineItems,
    Instant scrapedAt
) {

    public InsurerClaim {
        lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    }
}
