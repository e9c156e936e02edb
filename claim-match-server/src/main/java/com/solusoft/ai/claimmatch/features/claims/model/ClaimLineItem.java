package com.solusoft.ai.claimmatch.features.claims.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import lombok.Builder;

@Builder
public record ClaimLineItem(
    String treatmentDescription,
    LocalDate treatmentDate,
    BigDecimal claimAmount,
    String claimCurrency
) {}
