package com.solusoft.ai.claimmatch.features.documents.model;

import java.math.BigDecimal;
import java.time.Instant;

import lombok.Builder;

/**
 * Payment amount entered by a reviewer when OCR detection is wrong.
 * While present it is the only payment signal of the document.
 */
@Builder
public record PaymentOverride(
    BigDecimal amount,
    String currency,
    String note,
    Instant updatedAt
) {}
