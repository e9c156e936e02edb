package com.solusoft.ai.claimmatch.features.drafts.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import lombok.Builder;

/**
 * Provisional claim built from payment evidence that no insurer claim accounts for yet.
 */
@Builder(toBuilder = true)
public record DraftClaim(
    String id,
    DraftClaimStatus status,
    String primaryDocumentId,

    // Primary document, proofs and calendar events; no duplicates
    List<String> documentIds,
    DraftClaimPayment payment,
    List<String> paymentProofDocumentIds,
    String paymentProofText,

    String illnessId,
    String doctorNotes,
    LocalDate treatmentDate,
    TreatmentDateSource treatmentDateSource,
    List<String> calendarDocumentIds,

    Instant generatedAt,
    Instant updatedAt,
    Instant acceptedAt,
    Instant rejectedAt
) {

    public DraftClaim {
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
        paymentProofDocumentIds = paymentProofDocumentIds == null ? List.of() : List.copyOf(paymentProofDocumentIds);
        calendarDocumentIds = calendarDocumentIds == null ? List.of() : List.copyOf(calendarDocumentIds);
    }
}
