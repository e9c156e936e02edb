package com.solusoft.ai.claimmatch.features.drafts;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.solusoft.ai.claimmatch.config.DraftClaimProperties;
import com.solusoft.ai.claimmatch.features.assignments.model.Assignment;
import com.solusoft.ai.claimmatch.features.assignments.model.AssignmentStatus;
import com.solusoft.ai.claimmatch.features.assignments.model.MatchReasonType;
import com.solusoft.ai.claimmatch.features.assignments.repository.AssignmentStore;
import com.solusoft.ai.claimmatch.features.documents.model.DetectedAmount;
import com.solusoft.ai.claimmatch.features.documents.model.DocumentClassification;
import com.solusoft.ai.claimmatch.features.documents.model.DocumentSourceType;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;
import com.solusoft.ai.claimmatch.features.documents.repository.DocumentStore;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaim;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimPayment;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimRange;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimStatus;
import com.solusoft.ai.claimmatch.features.drafts.repository.JdbcDraftClaimStore;
import com.solusoft.ai.claimmatch.features.payment.PaymentSignalResolver;
import com.solusoft.ai.claimmatch.persistence.SqliteTestSupport;

public class DraftClaimGeneratorTest {

    private static final Instant NOW = Instant.parse("2026-01-16T00:00:00Z");

    @Mock
    private DocumentStore documentStore;

    @Mock
    private AssignmentStore assignmentStore;

    @TempDir
    Path tempDir;

    private JdbcDraftClaimStore draftClaimStore;
    private DraftClaimGenerator generator;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        DataSource dataSource = SqliteTestSupport.dataSource(tempDir);
        draftClaimStore = new JdbcDraftClaimStore(SqliteTestSupport.jdbcTemplate(dataSource),
                SqliteTestSupport.transactionTemplate(dataSource), SqliteTestSupport.codec(), clock);
        draftClaimStore.initSchema();

        PaymentSignalResolver paymentSignalResolver = new PaymentSignalResolver();
        generator = new DraftClaimGenerator(documentStore, assignmentStore, draftClaimStore, paymentSignalResolver,
                new ProofResolver(paymentSignalResolver, new DraftClaimProperties()), clock);

        when(assignmentStore.getAll()).thenReturn(List.of());
    }

    @Test
    public void testGenerate_unattachedAttachmentWithAmount_createsPendingDraft() {
        MedicalDocument bill = bill("doc-1", "120", "2026-01-10T00:00:00Z");
        when(documentStore.getAll()).thenReturn(List.of(bill));

        List<DraftClaim> created = generator.generate(DraftClaimRange.FOREVER, NOW);

        assertEquals(1, created.size());
        DraftClaim draft = created.get(0);
        assertEquals("doc-1", draft.primaryDocumentId());
        assertEquals(DraftClaimStatus.PENDING, draft.status());
        assertEquals(List.of("doc-1"), draft.documentIds());
        assertEquals(0, new BigDecimal("120").compareTo(draft.payment().amount()));
    }

    @Test
    public void testGenerate_skipsDocumentsAlreadyAssignedOrDrafted() {
        MedicalDocument assigned = bill("doc-assigned", "50", "2026-01-10T00:00:00Z").toBuilder()
                .classification(DocumentClassification.RECEIPT)
                .build();
        MedicalDocument drafted = bill("doc-drafted", "75", "2026-01-10T00:00:00Z");
        MedicalDocument valid = bill("doc-valid", "200", "2026-01-10T00:00:00Z");
        when(documentStore.getAll()).thenReturn(List.of(assigned, drafted, valid));
        when(assignmentStore.getAll()).thenReturn(List.of(Assignment.builder()
                .id("a-1")
                .documentId("doc-assigned")
                .claimId("claim-1")
                .matchScore(80)
                .matchReasonType(MatchReasonType.EXACT_AMOUNT)
                .status(AssignmentStatus.CANDIDATE)
                .build()));
        draftClaimStore.create(DraftClaim.builder()
                .status(DraftClaimStatus.PENDING)
                .primaryDocumentId("doc-drafted")
                .documentIds(List.of("doc-drafted"))
                .payment(DraftClaimPayment.builder().amount(new BigDecimal("75")).currency("EUR").build())
                .build());

        List<DraftClaim> created = generator.generate(DraftClaimRange.FOREVER, NOW);

        assertEquals(1, created.size());
        assertEquals("doc-valid", created.get(0).primaryDocumentId());
    }

    @Test
    public void testGenerate_respectsRequestedRange() {
        when(documentStore.getAll()).thenReturn(List.of(
                bill("doc-old", "45", "2025-12-01T00:00:00Z"),
                bill("doc-recent", "95", "2026-01-12T00:00:00Z"),
                bill("doc-undated", "30", null)));

        List<DraftClaim> created = generator.generate(DraftClaimRange.LAST_WEEK, NOW);

        assertEquals(1, created.size());
        assertEquals("doc-recent", created.get(0).primaryDocumentId());
    }

    @Test
    public void testGenerate_skipsNonBillsEmailsAndArchivedDocuments() {
        when(documentStore.getAll()).thenReturn(List.of(
                bill("doc-letter", "45", "2026-01-10T00:00:00Z").toBuilder().classification(DocumentClassification.CORRESPONDENCE).build(),
                bill("doc-email", "45", "2026-01-10T00:00:00Z").toBuilder().sourceType(DocumentSourceType.EMAIL).build(),
                bill("doc-archived", "45", "2026-01-10T00:00:00Z").toBuilder().archivedAt(NOW).build(),
                bill("doc-no-amount", "45", "2026-01-10T00:00:00Z").toBuilder().detectedAmounts(List.of()).build()));

        assertTrue(generator.generate(DraftClaimRange.FOREVER, NOW).isEmpty());
    }

    @Test
    public void testGenerate_attachesProofAndNeverDraftsItTwice() {
        MedicalDocument bill = bill("doc-bill", "120", "2026-01-10T00:00:00Z");
        MedicalDocument transfer = bill("doc-transfer", "120", "2026-01-11T00:00:00Z").toBuilder()
                .classification(DocumentClassification.RECEIPT)
                .subject("Bank transfer sent")
                .build();
        when(documentStore.getAll()).thenReturn(List.of(bill, transfer));

        List<DraftClaim> created = generator.generate(DraftClaimRange.FOREVER, NOW);

        assertEquals(1, created.size());
        assertEquals(List.of("doc-bill", "doc-transfer"), created.get(0).documentIds());
        assertEquals(List.of("doc-transfer"), created.get(0).paymentProofDocumentIds());
    }

    @Test
    public void testGenerate_paymentSnapshotSurvivesDocumentChanges() {
        MedicalDocument bill = bill("doc-1", "120", "2026-01-10T00:00:00Z");
        when(documentStore.getAll()).thenReturn(List.of(bill));
        DraftClaim draft = generator.generate(DraftClaimRange.FOREVER, NOW).get(0);

        when(documentStore.getAll()).thenReturn(List.of(bill.toBuilder()
                .detectedAmounts(List.of(amount("999")))
                .build()));
        List<DraftClaim> secondRun = generator.generate(DraftClaimRange.FOREVER, NOW);

        assertTrue(secondRun.isEmpty());
        DraftClaim stored = draftClaimStore.get(draft.id()).orElseThrow();
        assertEquals(0, new BigDecimal("120").compareTo(stored.payment().amount()));
    }

    private static MedicalDocument bill(String id, String amount, String date) {
        return MedicalDocument.builder()
                .id(id)
                .sourceType(DocumentSourceType.ATTACHMENT)
                .classification(DocumentClassification.MEDICAL_BILL)
                .date(date != null ? Instant.parse(date) : null)
                .detectedAmounts(List.of(amount(amount)))
                .build();
    }

    private static DetectedAmount amount(String value) {
        return DetectedAmount.builder()
                .value(new BigDecimal(value))
                .currency("EUR")
                .rawText("EUR " + value)
                .confidence(90)
                .build();
    }
}
