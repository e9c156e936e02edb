package com.solusoft.ai.claimmatch.features.matching;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.solusoft.ai.claimmatch.config.MatchingProperties;
import com.solusoft.ai.claimmatch.exception.MatchingException;
import com.solusoft.ai.claimmatch.exception.NotFoundException;
import com.solusoft.ai.claimmatch.features.assignments.model.Assignment;
import com.solusoft.ai.claimmatch.features.assignments.model.AssignmentStatus;
import com.solusoft.ai.claimmatch.features.assignments.repository.AssignmentStore;
import com.solusoft.ai.claimmatch.features.claims.model.InsurerClaim;
import com.solusoft.ai.claimmatch.features.claims.repository.ClaimStore;
import com.solusoft.ai.claimmatch.features.documents.model.DocumentClassification;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;
import com.solusoft.ai.claimmatch.features.documents.repository.DocumentStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns scored document/claim pairs into candidate assignments.
 *
 * <p>Only the best {@code maxCandidatesPerDocument} matches of a document are kept. Stale
 * candidates (claims that dropped out of that list) are removed first; candidates still in the
 * list keep their id and are refreshed with the new score. Confirmed and rejected rows are
 * returned as they are and never rescored.
 */
@Service
@Slf4j
public class AssignmentEngine {

    private final MatchScorer scorer;
    private final DocumentStore documentStore;
    private final ClaimStore claimStore;
    private final AssignmentStore assignmentStore;
    private final MatchingProperties properties;

    public AssignmentEngine(MatchScorer scorer, DocumentStore documentStore, ClaimStore claimStore,
                            AssignmentStore assignmentStore, MatchingProperties properties) {
        this.scorer = scorer;
        this.documentStore = documentStore;
        this.claimStore = claimStore;
        this.assignmentStore = assignmentStore;
        this.properties = properties;
    }

    public List<Assignment> matchDocument(MedicalDocument document) {
        if (!isMatchable(document)) {
            log.debug("Document {} has no amounts and is not a dated calendar event, skipping", document.id());
            return List.of();
        }

        List<MatchResult> topMatches = scoreAgainstClaims(document, claimStore.getAll());

        if (properties.isClearExistingCandidates()) {
            assignmentStore.clearCandidatesForDocument(document.id(),
                    topMatches.stream().map(MatchResult::claimId).toList());
        }

        List<Assignment> assignments = new ArrayList<>();
        for (MatchResult match : topMatches) {
            Optional<Assignment> existing = assignmentStore.findByPair(match.documentId(), match.claimId());
            if (existing.isPresent()) {
                assignments.add(refreshCandidate(existing.get(), match));
                continue;
            }
            assignments.add(assignmentStore.createIfAbsent(toAssignment(match)));
        }

        log.debug("Document {} matched {} claim(s)", document.id(), assignments.size());
        return assignments;
    }

    /**
     * Matches every medical bill with detected amounts and every dated calendar event.
     */
    public List<Assignment> matchAllDocuments() {
        List<MedicalDocument> matchable = documentStore.getAll().stream()
                .filter(d -> (d.classification() == DocumentClassification.MEDICAL_BILL && !d.detectedAmounts().isEmpty())
                        || (d.isCalendarEvent() && d.effectiveDate() != null))
                .toList();

        long calendarEvents = matchable.stream().filter(MedicalDocument::isCalendarEvent).count();
        log.info("Matching {} documents against claims ({} calendar events)", matchable.size(), calendarEvents);

        List<Assignment> all = new ArrayList<>();
        for (MedicalDocument document : matchable) {
            all.addAll(matchDocument(document));
        }

        log.info("✓ Matching produced {} assignment(s)", all.size());
        return all;
    }

    public List<Assignment> matchDocuments(Collection<MedicalDocument> documents) {
        Map<String, MedicalDocument> unique = new LinkedHashMap<>();
        documents.forEach(d -> unique.putIfAbsent(d.id(), d));

        List<Assignment> all = new ArrayList<>();
        for (MedicalDocument document : unique.values()) {
            all.addAll(matchDocument(document));
        }
        return all;
    }

    /**
     * Unknown ids are skipped.
     */
    public List<Assignment> matchDocumentsByIds(Collection<String> documentIds) {
        List<MedicalDocument> documents = new LinkedHashSet<>(documentIds).stream()
                .map(documentStore::get)
                .flatMap(Optional::stream)
                .toList();
        return matchDocuments(documents);
    }

    public List<Assignment> matchDocumentById(String documentId) {
        MedicalDocument document = documentStore.get(documentId)
                .orElseThrow(() -> new NotFoundException("Document", documentId));
        return matchDocument(document);
    }

    private boolean isMatchable(MedicalDocument document) {
        return !document.detectedAmounts().isEmpty()
                || (document.isCalendarEvent() && document.effectiveDate() != null);
    }

    private List<MatchResult> scoreAgainstClaims(MedicalDocument document, List<InsurerClaim> claims) {
        List<MatchResult> matches = new ArrayList<>();
        for (InsurerClaim claim : claims) {
            Optional<MatchResult> match;
            try {
                match = scorer.score(document, claim);
            } catch (RuntimeException e) {
                log.error("❌ Scoring failed for document {} against claim {}", document.id(), claim.id(), e);
                throw new MatchingException(document.id(), claim.id(), e);
            }
            match.filter(m -> m.score() >= properties.getMinimumCandidateScore()).ifPresent(matches::add);
        }

        return matches.stream()
                .sorted(Comparator.comparingDouble(MatchResult::score).reversed())
                .limit(properties.getMaxCandidatesPerDocument())
                .toList();
    }

    private Assignment refreshCandidate(Assignment existing, MatchResult match) {
        if (existing.status() != AssignmentStatus.CANDIDATE) {
            return existing;
        }
        Assignment refreshed = existing.toBuilder()
                .matchScore(match.score())
                .matchReasonType(match.primaryReasonType())
                .matchReason(match.describeReasons())
                .amountMatchDetails(match.amountMatchDetails())
                .dateMatchDetails(match.dateMatchDetails())
                .build();

        boolean unchanged = existing.matchScore() == refreshed.matchScore()
                && existing.matchReasonType() == refreshed.matchReasonType()
                && Objects.equals(existing.matchReason(), refreshed.matchReason())
                && Objects.equals(existing.amountMatchDetails(), refreshed.amountMatchDetails())
                && Objects.equals(existing.dateMatchDetails(), refreshed.dateMatchDetails());
        return unchanged ? existing : assignmentStore.update(refreshed);
    }

    private Assignment toAssignment(MatchResult match) {
        return Assignment.builder()
                .documentId(match.documentId())
                .claimId(match.claimId())
                .matchScore(match.score())
                .matchReasonType(match.primaryReasonType())
                .matchReason(match.describeReasons())
                .status(AssignmentStatus.CANDIDATE)
                .amountMatchDetails(match.amountMatchDetails())
                .dateMatchDetails(match.dateMatchDetails())
                .build();
    }
}
