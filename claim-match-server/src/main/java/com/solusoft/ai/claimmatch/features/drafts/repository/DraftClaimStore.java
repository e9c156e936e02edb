package com.solusoft.ai.claimmatch.features.drafts.repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaim;

public interface DraftClaimStore {

    List<DraftClaim> getAll();

    Optional<DraftClaim> get(String id);

    List<DraftClaim> find(Predicate<DraftClaim> filter);

    /**
     * Stores a new draft unless one of its documents already belongs to another draft.
     *
     * @return the stored draft, or empty when a document was already claimed
     */
    Optional<DraftClaim> create(DraftClaim draft);

    DraftClaim update(DraftClaim draft);
}
