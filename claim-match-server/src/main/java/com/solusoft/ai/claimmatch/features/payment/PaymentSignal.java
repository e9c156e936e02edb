package com.solusoft.ai.claimmatch.features.payment;

import java.math.BigDecimal;
import java.time.Instant;

import lombok.Builder;

/**
 * Normalized view of one payment amount of a document, detected or overridden.
 */
@Builder
public record PaymentSignal(
    BigDecimal amount,
    String currency,
    String rawText,
    String context,
    int confidence,
    PaymentSignalSource source,
    String overrideNote,
    Instant overrideUpdatedAt
) {}
