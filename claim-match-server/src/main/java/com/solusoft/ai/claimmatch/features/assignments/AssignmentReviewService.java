package com.solusoft.ai.claimmatch.features.assignments;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.springframework.stereotype.Service;

import com.solusoft.ai.claimmatch.exception.NotFoundException;
import com.solusoft.ai.claimmatch.exception.ValidationException;
import com.solusoft.ai.claimmatch.features.assignments.model.Assignment;
import com.solusoft.ai.claimmatch.features.assignments.model.AssignmentStatus;
import com.solusoft.ai.claimmatch.features.assignments.model.MatchReasonType;
import com.solusoft.ai.claimmatch.features.assignments.repository.AssignmentStore;
import com.solusoft.ai.claimmatch.features.claims.repository.ClaimStore;
import com.solusoft.ai.claimmatch.features.documents.repository.DocumentStore;
import com.solusoft.ai.claimmatch.features.illnesses.model.RelevantAccount;
import com.solusoft.ai.claimmatch.features.illnesses.repository.IllnessStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Reviewer decisions on assignments.
 */
@Service
@Slf4j
public class AssignmentReviewService {

    private static final double MANUAL_SCORE = 100;

    private final AssignmentStore assignmentStore;
    private final DocumentStore documentStore;
    private final ClaimStore claimStore;
    private final IllnessStore illnessStore;
    private final AccountExtractor accountExtractor;
    private final Clock clock;

    public AssignmentReviewService(AssignmentStore assignmentStore, DocumentStore documentStore, ClaimStore claimStore,
                                   IllnessStore illnessStore, AccountExtractor accountExtractor, Clock clock) {
        this.assignmentStore = assignmentStore;
        this.documentStore = documentStore;
        this.claimStore = claimStore;
        this.illnessStore = illnessStore;
        this.accountExtractor = accountExtractor;
        this.clock = clock;
    }

    /**
     * Confirms a candidate and copies the matched document's contacts onto the illness.
     *
     * @param reviewer principal recorded as {@code confirmedBy}; may be null
     */
    public Assignment confirmAssignment(String assignmentId, String illnessId, String reviewNotes, String reviewer) {
        if (illnessId == null || illnessId.isBlank()) {
            throw new ValidationException("illnessId is required to confirm an assignment");
        }
        illnessStore.get(illnessId).orElseThrow(() -> new NotFoundException("Illness", illnessId));
        Assignment assignment = load(assignmentId);
        requireTransition(assignment, AssignmentStatus.CONFIRMED);

        documentStore.get(assignment.documentId()).ifPresent(document -> {
            List<RelevantAccount> accounts = accountExtractor.extract(document);
            if (!accounts.isEmpty()) {
                illnessStore.mergeRelevantAccounts(illnessId, accounts);
            }
        });

        Assignment confirmed = assignmentStore.update(assignment.toBuilder()
                .status(AssignmentStatus.CONFIRMED)
                .illnessId(illnessId)
                .reviewNotes(reviewNotes)
                .confirmedBy(reviewer)
                .confirmedAt(Instant.now(clock))
                .build());
        log.info("✓ Assignment {} confirmed for illness {} by {}", assignmentId, illnessId, reviewer);
        return confirmed;
    }

    public Assignment rejectAssignment(String assignmentId, String reviewNotes) {
        Assignment assignment = load(assignmentId);
        requireTransition(assignment, AssignmentStatus.REJECTED);

        Assignment rejected = assignmentStore.update(assignment.toBuilder()
                .status(AssignmentStatus.REJECTED)
                .reviewNotes(reviewNotes)
                .build());
        log.info("✓ Assignment {} rejected", assignmentId);
        return rejected;
    }

    /**
     * Links a document to a claim by hand. An existing assignment for the pair is returned as is.
     */
    public Assignment createManualAssignment(String documentId, String claimId, String reviewNotes) {
        documentStore.get(documentId).orElseThrow(() -> new NotFoundException("Document", documentId));
        claimStore.get(claimId).orElseThrow(() -> new NotFoundException("Claim", claimId));

        return assignmentStore.findByPair(documentId, claimId).orElseGet(() -> {
            log.info("Creating manual assignment for document {} / claim {}", documentId, claimId);
            return assignmentStore.createIfAbsent(Assignment.builder()
                    .documentId(documentId)
                    .claimId(claimId)
                    .matchScore(MANUAL_SCORE)
                    .matchReasonType(MatchReasonType.MANUAL)
                    .matchReason(reviewNotes != null && !reviewNotes.isBlank() ? reviewNotes : "Manually assigned by user")
                    .status(AssignmentStatus.CANDIDATE)
                    .build());
        });
    }

    /**
     * Accounts a confirmation would add to an illness, without writing anything.
     */
    public List<RelevantAccount> previewAccounts(String assignmentId) {
        Assignment assignment = load(assignmentId);
        return documentStore.get(assignment.documentId())
                .map(accountExtractor::extract)
                .orElseThrow(() -> new NotFoundException("Document", assignment.documentId()));
    }

    private Assignment load(String assignmentId) {
        return assignmentStore.get(assignmentId).orElseThrow(() -> new NotFoundException("Assignment", assignmentId));
    }

    private void requireTransition(Assignment assignment, AssignmentStatus target) {
        if (!assignment.status().canTransitionTo(target)) {
            throw new ValidationException("Assignment " + assignment.id() + " is already " + assignment.status().value());
        }
    }
}
