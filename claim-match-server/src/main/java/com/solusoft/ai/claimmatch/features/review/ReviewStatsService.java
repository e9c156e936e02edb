package com.solusoft.ai.claimmatch.features.review;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.springframework.stereotype.Service;

import com.solusoft.ai.claimmatch.features.assignments.model.Assignment;
import com.solusoft.ai.claimmatch.features.assignments.model.AssignmentStatus;
import com.solusoft.ai.claimmatch.features.assignments.repository.AssignmentStore;
import com.solusoft.ai.claimmatch.features.claims.repository.ClaimStore;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;
import com.solusoft.ai.claimmatch.features.documents.repository.DocumentStore;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaim;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimStatus;
import com.solusoft.ai.claimmatch.features.drafts.repository.DraftClaimStore;
import com.solusoft.ai.claimmatch.features.review.model.ReviewStats;
import com.solusoft.ai.claimmatch.features.review.model.ReviewStats.StatusCounts;

@Service
public class ReviewStatsService {

    private final ClaimStore claimStore;
    private final DocumentStore documentStore;
    private final AssignmentStore assignmentStore;
    private final DraftClaimStore draftClaimStore;

    public ReviewStatsService(ClaimStore claimStore, DocumentStore documentStore,
                              AssignmentStore assignmentStore, DraftClaimStore draftClaimStore) {
        this.claimStore = claimStore;
        this.documentStore = documentStore;
        this.assignmentStore = assignmentStore;
        this.draftClaimStore = draftClaimStore;
    }

    public ReviewStats getStats() {
        List<MedicalDocument> documents = documentStore.getAll();
        List<Assignment> assignments = assignmentStore.getAll();
        List<DraftClaim> drafts = draftClaimStore.getAll();

        List<Assignment> candidates = assignments.stream()
                .filter(a -> a.status() == AssignmentStatus.CANDIDATE)
                .toList();

        return ReviewStats.builder()
                .claims(claimStore.getAll().size())
                .documents(documents.size())
                .documentsWithAmounts(documents.stream().filter(d -> !d.detectedAmounts().isEmpty()).count())
                .assignments(countByStatus(assignments, Arrays.stream(AssignmentStatus.values()).map(AssignmentStatus::value).toList(),
                        a -> a.status().value()))
                .draftClaims(countByStatus(drafts, Arrays.stream(DraftClaimStatus.values()).map(DraftClaimStatus::value).toList(),
                        d -> d.status().value()))
                .averageCandidateScore(candidates.stream().mapToDouble(Assignment::matchScore).average().orElse(0))
                .candidateScoreHistogram(histogram(candidates))
                .build();
    }

    static String scoreBucket(double score) {
        if (score >= 90) {
            return "90-100";
        } else if (score >= 80) {
            return "80-89";
        } else if (score >= 70) {
            return "70-79";
        } else if (score >= 60) {
            return "60-69";
        }
        return "<60";
    }

    private Map<String, Long> histogram(List<Assignment> candidates) {
        Map<String, Long> buckets = new LinkedHashMap<>();
        for (String bucket : List.of("90-100", "80-89", "70-79", "60-69", "<60")) {
            buckets.put(bucket, 0L);
        }
        candidates.forEach(a -> buckets.merge(scoreBucket(a.matchScore()), 1L, Long::sum));
        return buckets;
    }

    private <T> StatusCounts countByStatus(List<T> items, List<String> statuses, Function<T, String> statusOf) {
        Map<String, Long> counts = new LinkedHashMap<>();
        statuses.forEach(s -> counts.put(s, 0L));
        items.forEach(item -> counts.merge(statusOf.apply(item), 1L, Long::sum));
        return new StatusCounts(items.size(), counts);
    }
}
