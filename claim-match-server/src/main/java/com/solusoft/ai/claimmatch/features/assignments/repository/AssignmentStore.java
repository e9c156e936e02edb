package com.solusoft.ai.claimmatch.features.assignments.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import com.solusoft.ai.claimmatch.features.assignments.model.Assignment;

public interface AssignmentStore {

    List<Assignment> getAll();

    Optional<Assignment> get(String id);

    List<Assignment> find(Predicate<Assignment> filter);

    Optional<Assignment> findByPair(String documentId, String claimId);

    List<Assignment> findByDocument(String documentId);

    /**
     * Inserts the assignment unless its (documentId, claimId) pair is already stored,
     * in which case the stored row is returned untouched.
     */
    Assignment createIfAbsent(Assignment assignment);

    Assignment update(Assignment assignment);

    /**
     * Deletes the CANDIDATE rows of a document whose claim is not in {@code retainedClaimIds}.
     * Confirmed and rejected rows are never deleted.
     *
     * @return number of deleted rows
     */
    int clearCandidatesForDocument(String documentId, Collection<String> retainedClaimIds);
}
