package com.solusoft.ai.claimmatch.features.assignments.model;

import java.time.Instant;

import lombok.Builder;

/**
 * Link between a medical document and an insurer claim.
 * At most one assignment exists per (documentId, claimId) pair.
 */
@Builder(toBuilder = true)
public record Assignment(
    String id,
    String documentId,
    String claimId,

    // Required once confirmed
    String illnessId,

    double matchScore,
    MatchReasonType matchReasonType,
    String matchReason,
    AssignmentStatus status,
    AmountMatchDetails amountMatchDetails,
    DateMatchDetails dateMatchDetails,

    Instant createdAt,
    Instant updatedAt,
    Instant confirmedAt,
    String confirmedBy,
    String reviewNotes
) {}
