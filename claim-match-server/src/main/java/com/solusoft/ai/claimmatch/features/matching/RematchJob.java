package com.solusoft.ai.claimmatch.features.matching;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.solusoft.ai.claimmatch.features.assignments.model.Assignment;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaim;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimStatus;
import com.solusoft.ai.claimmatch.features.drafts.repository.DraftClaimStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Batch rematching, on a schedule ({@code claimmatch.rematch.cron}, off by default) or on demand.
 * Only one batch runs at a time; a trigger that arrives while one is running is refused.
 */
@Component
@Slf4j
public class RematchJob {

    private final AssignmentEngine assignmentEngine;
    private final DraftClaimStore draftClaimStore;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RematchJob(AssignmentEngine assignmentEngine, DraftClaimStore draftClaimStore) {
        this.assignmentEngine = assignmentEngine;
        this.draftClaimStore = draftClaimStore;
    }

    @Scheduled(cron = "${claimmatch.rematch.cron:-}", zone = "UTC")
    public void scheduledRematch() {
        rematchAll().ifPresentOrElse(
                assignments -> log.info("✓ Scheduled rematch finished with {} assignment(s)", assignments.size()),
                () -> log.info("Scheduled rematch skipped: previous run still in progress"));
    }

    /**
     * @return the assignments, or empty when another batch is already running
     */
    public Optional<List<Assignment>> rematchAll() {
        return runExclusive("rematch_all", assignmentEngine::matchAllDocuments);
    }

    /**
     * Rematches every document referenced by an accepted draft claim.
     */
    public Optional<List<Assignment>> matchAcceptedDrafts() {
        return runExclusive("match_accepted_drafts", () -> {
            List<String> documentIds = draftClaimStore.find(d -> d.status() == DraftClaimStatus.ACCEPTED).stream()
                    .map(DraftClaim::documentIds)
                    .flatMap(List::stream)
                    .distinct()
                    .toList();
            if (documentIds.isEmpty()) {
                return List.of();
            }
            return assignmentEngine.matchDocumentsByIds(documentIds);
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    private Optional<List<Assignment>> runExclusive(String name, Supplier<List<Assignment>> batch) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Batch {} refused: a rematch is already running", name);
            return Optional.empty();
        }
        try {
            return Optional.of(batch.get());
        } finally {
            running.set(false);
        }
    }
}
