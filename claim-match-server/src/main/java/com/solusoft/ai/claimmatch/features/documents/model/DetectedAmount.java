package com.solusoft.ai.claimmatch.features.documents.model;

import java.math.BigDecimal;

import lombok.Builder;

/**
 * Amount found in the OCR text of a document.
 *
 * @param value      parsed numeric value
 * @param currency   ISO currency code (e.g. "EUR")
 * @param rawText    text the value was parsed from (e.g. "EUR 80.00")
 * @param context    optional surrounding text
 * @param confidence detection confidence, 0-100
 */
@Builder
public record DetectedAmount(
    BigDecimal value,
    String currency,
    String rawText,
    String context,
    int confidence
) {}
