package com.solusoft.ai.claimmatch.features.review.model;

import java.util.Map;

import lombok.Builder;

@Builder
public record ReviewStats(
    long claims,
    long documents,
    long documentsWithAmounts,
    StatusCounts assignments,
    StatusCounts draftClaims,
    double averageCandidateScore,
    Map<String, Long> candidateScoreHistogram // "90-100" ... "<60"
) {

    /**
     * Counts per status, keyed by the status wire value.
     */
    public record StatusCounts(long total, Map<String, Long> byStatus) {}
}
