package com.solusoft.ai.claimmatch.features.drafts.model;

import java.math.BigDecimal;
import java.time.Instant;

import com.solusoft.ai.claimmatch.features.payment.PaymentSignalSource;

import lombok.Builder;

/**
 * Payment captured when a draft claim is generated. It is a copy, so later edits
 * to the source document (new OCR amounts, a changed override) do not reach the draft.
 * {@code source} is null for drafts promoted without any payment signal.
 */
@Builder
public record DraftClaimPayment(
    BigDecimal amount,
    String currency,
    PaymentSignalSource source,
    String rawText,
    String context,
    Integer confidence,
    String overrideNote,
    Instant overrideUpdatedAt
) {}
