package com.solusoft.ai.claimmatch.features.assignments.model;

import java.math.BigDecimal;

/**
 * Snapshot of the best amount comparison made while scoring.
 * {@code differencePercent} is a fraction of the claim amount (0.01 = 1%).
 */
public record AmountMatchDetails(
    BigDecimal documentAmount,
    String documentCurrency,
    BigDecimal claimAmount,
    String claimCurrency,
    BigDecimal difference,
    double differencePercent
) {}
