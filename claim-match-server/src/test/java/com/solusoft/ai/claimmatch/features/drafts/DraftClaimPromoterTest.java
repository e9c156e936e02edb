package com.solusoft.ai.claimmatch.features.drafts;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.solusoft.ai.claimmatch.config.DraftClaimProperties;
import com.solusoft.ai.claimmatch.exception.NotFoundException;
import com.solusoft.ai.claimmatch.features.documents.model.DetectedAmount;
import com.solusoft.ai.claimmatch.features.documents.model.DocumentClassification;
import com.solusoft.ai.claimmatch.features.documents.model.DocumentSourceType;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;
import com.solusoft.ai.claimmatch.features.documents.model.PaymentOverride;
import com.solusoft.ai.claimmatch.features.documents.repository.DocumentStore;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaim;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimPayment;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimStatus;
import com.solusoft.ai.claimmatch.features.drafts.model.PromoteDraftResult;
import com.solusoft.ai.claimmatch.features.drafts.repository.JdbcDraftClaimStore;
import com.solusoft.ai.claimmatch.features.payment.PaymentSignalResolver;
import com.solusoft.ai.claimmatch.features.payment.PaymentSignalSource;
import com.solusoft.ai.claimmatch.persistence.SqliteTestSupport;

public class DraftClaimPromoterTest {

    @Mock
    private DocumentStore documentStore;

    @TempDir
    Path tempDir;

    private JdbcDraftClaimStore draftClaimStore;
    private DraftClaimPromoter promoter;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);

        DataSource dataSource = SqliteTestSupport.dataSource(tempDir);
        draftClaimStore = new JdbcDraftClaimStore(SqliteTestSupport.jdbcTemplate(dataSource),
                SqliteTestSupport.transactionTemplate(dataSource), SqliteTestSupport.codec(),
                Clock.fixed(Instant.parse("2026-01-16T00:00:00Z"), ZoneOffset.UTC));
        draftClaimStore.initSchema();

        DraftClaimProperties properties = new DraftClaimProperties();
        PaymentSignalResolver paymentSignalResolver = new PaymentSignalResolver();
        promoter = new DraftClaimPromoter(documentStore, draftClaimStore, paymentSignalResolver,
                new ProofResolver(paymentSignalResolver, properties), properties);
    }

    @Test
    public void testPromote_emailAttachments_strongestSignalBecomesPrimary() {
        MedicalDocument detected = attachment("doc-a", "email-1").toBuilder()
                .detectedAmounts(List.of(amount("50.00", 80)))
                .build();
        MedicalDocument overridden = attachment("doc-b", "email-1").toBuilder()
                .paymentOverride(PaymentOverride.builder()
                        .amount(new BigDecimal("60.00"))
                        .currency("EUR")
                        .note("Corrected total")
                        .build())
                .build();
        MedicalDocument unrelated = attachment("doc-c", "email-2");
        stubDocuments(detected, overridden, unrelated);

        PromoteDraftResult result = promoter.promote("doc-a");

        assertTrue(result.created());
        assertFalse(result.expanded());
        DraftClaim draft = result.draft();
        assertEquals(DraftClaimStatus.PENDING, draft.status());
        assertEquals("doc-b", draft.primaryDocumentId());
        assertEquals(List.of("doc-a", "doc-b"), draft.documentIds());
        assertEquals(PaymentSignalSource.OVERRIDE, draft.payment().source());
        assertEquals(0, new BigDecimal("60.00").compareTo(draft.payment().amount()));
    }

    @Test
    public void testPromote_noPaymentSignal_startsWithZeroAmount() {
        stubDocuments(attachment("doc-a", null));

        PromoteDraftResult result = promoter.promote("doc-a");

        DraftClaimPayment payment = result.draft().payment();
        assertTrue(result.created());
        assertEquals(0, BigDecimal.ZERO.compareTo(payment.amount()));
        assertEquals("EUR", payment.currency());
        assertNull(payment.source());
        assertEquals(DraftClaimPromoter.EMPTY_PAYMENT_CONTEXT, payment.context());
    }

    @Test
    public void testPromote_existingDraftForThread_isExpandedThenLeftAlone() {
        MedicalDocument first = attachment("doc-a", "email-1").toBuilder()
                .detectedAmounts(List.of(amount("50.00", 80)))
                .build();
        MedicalDocument second = attachment("doc-b", "email-1");
        stubDocuments(first, second);
        DraftClaim existing = draftClaimStore.create(DraftClaim.builder()
                .primaryDocumentId("doc-a")
                .documentIds(List.of("doc-a"))
                .payment(DraftClaimPayment.builder().amount(new BigDecimal("50.00")).currency("EUR").build())
                .build()).orElseThrow();

        PromoteDraftResult expanded = promoter.promote("doc-b");

        assertFalse(expanded.created());
        assertTrue(expanded.expanded());
        assertEquals(existing.id(), expanded.draft().id());
        assertEquals(List.of("doc-a", "doc-b"), expanded.draft().documentIds());
        assertEquals(1, draftClaimStore.getAll().size());

        PromoteDraftResult again = promoter.promote("doc-b");

        assertFalse(again.created());
        assertFalse(again.expanded());
        assertEquals(List.of("doc-a", "doc-b"), again.draft().documentIds());
    }

    @Test
    public void testPromote_receiptHeldByAnotherDraft_isNotUsedAsProof() {
        MedicalDocument receipt = attachment("rcpt", "email-1").toBuilder()
                .classification(DocumentClassification.RECEIPT)
                .detectedAmounts(List.of(amount("50.00", 90)))
                .build();
        MedicalDocument bill = attachment("bill", "email-2").toBuilder()
                .detectedAmounts(List.of(amount("50.00", 90)))
                .build();
        stubDocuments(receipt, bill);
        draftClaimStore.create(DraftClaim.builder()
                .primaryDocumentId("rcpt")
                .documentIds(List.of("rcpt"))
                .payment(DraftClaimPayment.builder().amount(new BigDecimal("50.00")).currency("EUR").build())
                .build()).orElseThrow();

        PromoteDraftResult result = promoter.promote("bill");

        assertTrue(result.created());
        assertEquals(List.of("bill"), result.draft().documentIds());
        assertTrue(result.draft().paymentProofDocumentIds().isEmpty());
        assertEquals(2, draftClaimStore.getAll().size());
    }

    @Test
    public void testPromote_archivedSibling_isLeftOut() {
        MedicalDocument selected = attachment("doc-a", "email-1");
        MedicalDocument archived = attachment("doc-b", "email-1").toBuilder()
                .archivedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
        stubDocuments(selected, archived);

        PromoteDraftResult result = promoter.promote("doc-a");

        assertEquals(List.of("doc-a"), result.draft().documentIds());
    }

    @Test
    public void testPromote_unknownDocument_throwsNotFound() {
        stubDocuments();

        assertThrows(NotFoundException.class, () -> promoter.promote("doc-missing"));
    }

    private void stubDocuments(MedicalDocument... documents) {
        when(documentStore.getAll()).thenReturn(List.of(documents));
        for (MedicalDocument document : documents) {
            when(documentStore.get(document.id())).thenReturn(Optional.of(document));
        }
    }

    private static MedicalDocument attachment(String id, String emailId) {
        return MedicalDocument.builder()
                .id(id)
                .emailId(emailId)
                .sourceType(DocumentSourceType.ATTACHMENT)
                .classification(DocumentClassification.MEDICAL_BILL)
                .date(Instant.parse("2026-01-10T00:00:00Z"))
                .build();
    }

    private static DetectedAmount amount(String value, int confidence) {
        return DetectedAmount.builder()
                .value(new BigDecimal(value))
                .currency("EUR")
                .rawText("EUR " + value)
                .confidence(confidence)
                .build();
    }
}
