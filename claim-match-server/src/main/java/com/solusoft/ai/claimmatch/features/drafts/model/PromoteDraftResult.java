package com.solusoft.ai.claimmatch.features.drafts.model;

/**
 * Outcome of promoting a document to a draft claim.
 *
 * @param created  a new draft was stored
 * @param expanded an existing draft gained documents
 */
public record PromoteDraftResult(
    DraftClaim draft,
    boolean created,
    boolean expanded
) {}
