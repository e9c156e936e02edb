package com.solusoft.ai.claimmatch.features.matching;

import com.solusoft.ai.claimmatch.features.assignments.model.MatchReasonType;

/**
 * One scoring contribution. Penalties carry a negative score.
 */
public record MatchReason(
    MatchReasonType type,
    double score,
    String description
) {}
