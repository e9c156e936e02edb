package com.solusoft.ai.claimmatch.features.matching;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.solusoft.ai.claimmatch.features.assignments.model.Assignment;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaim;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimStatus;
import com.solusoft.ai.claimmatch.features.drafts.repository.DraftClaimStore;

public class RematchJobTest {

    @Mock
    private AssignmentEngine assignmentEngine;

    @Mock
    private DraftClaimStore draftClaimStore;

    private RematchJob job;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        job = new RematchJob(assignmentEngine, draftClaimStore);
    }

    @Test
    public void testRematchAll_whileRunning_refusesSecondTrigger() {
        List<Optional<List<Assignment>>> nested = new ArrayList<>();
        when(assignmentEngine.matchAllDocuments()).thenAnswer(invocation -> {
            assertTrue(job.isRunning());
            nested.add(job.rematchAll());
            nested.add(job.matchAcceptedDrafts());
            return List.of();
        });

        Optional<List<Assignment>> outer = job.rematchAll();

        assertTrue(outer.isPresent());
        assertEquals(List.of(Optional.empty(), Optional.empty()), nested);
        assertFalse(job.isRunning());
    }

    @Test
    public void testRematchAll_failure_releasesGuard() {
        when(assignmentEngine.matchAllDocuments()).thenThrow(new IllegalStateException("boom"));

        assertThrows(IllegalStateException.class, () -> job.rematchAll());
        assertFalse(job.isRunning());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testMatchAcceptedDrafts_rematchesEveryDocumentOnce() {
        List<DraftClaim> drafts = List.of(
                DraftClaim.builder().id("d-1").status(DraftClaimStatus.ACCEPTED).documentIds(List.of("doc-1", "doc-2")).build(),
                DraftClaim.builder().id("d-2").status(DraftClaimStatus.ACCEPTED).documentIds(List.of("doc-2", "cal-1")).build(),
                DraftClaim.builder().id("d-3").status(DraftClaimStatus.PENDING).documentIds(List.of("doc-9")).build());
        when(draftClaimStore.find(any(Predicate.class))).thenAnswer(invocation -> {
            Predicate<DraftClaim> filter = invocation.getArgument(0);
            return drafts.stream().filter(filter).toList();
        });
        when(assignmentEngine.matchDocumentsByIds(List.of("doc-1", "doc-2", "cal-1"))).thenReturn(List.of());

        Optional<List<Assignment>> result = job.matchAcceptedDrafts();

        assertTrue(result.isPresent());
        verify(assignmentEngine).matchDocumentsByIds(List.of("doc-1", "doc-2", "cal-1"));
    }

    @Test
    public void testMatchAcceptedDrafts_noAcceptedDrafts_skipsEngine() {
        when(draftClaimStore.find(any())).thenReturn(List.of());

        assertEquals(Optional.of(List.of()), job.matchAcceptedDrafts());
        verify(assignmentEngine, never()).matchDocumentsByIds(any());
    }
}
