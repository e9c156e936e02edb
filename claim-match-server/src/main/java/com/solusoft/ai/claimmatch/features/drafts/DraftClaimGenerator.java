package com.solusoft.ai.claimmatch.features.drafts;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.springframework.stereotype.Service;

import com.solusoft.ai.claimmatch.features.assignments.model.Assignment;
import com.solusoft.ai.claimmatch.features.assignments.repository.AssignmentStore;
import com.solusoft.ai.claimmatch.features.documents.model.DocumentClassification;
import com.solusoft.ai.claimmatch.features.documents.model.DocumentSourceType;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;
import com.solusoft.ai.claimmatch.features.documents.repository.DocumentStore;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaim;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimPayment;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimRange;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimStatus;
import com.solusoft.ai.claimmatch.features.drafts.repository.DraftClaimStore;
import com.solusoft.ai.claimmatch.features.payment.PaymentSignalResolver;

import lombok.extern.slf4j.Slf4j;

/**
 * Creates pending draft claims for bill attachments that carry a payment but are not
 * linked to any insurer claim or existing draft yet.
 */
@Service
@Slf4j
public class DraftClaimGenerator {

    private static final Set<DocumentClassification> BILL_LIKE =
            Set.of(DocumentClassification.MEDICAL_BILL, DocumentClassification.RECEIPT);

    private final DocumentStore documentStore;
    private final AssignmentStore assignmentStore;
    private final DraftClaimStore draftClaimStore;
    private final PaymentSignalResolver paymentSignalResolver;
    private final ProofResolver proofResolver;
    private final Clock clock;

    public DraftClaimGenerator(DocumentStore documentStore, AssignmentStore assignmentStore, DraftClaimStore draftClaimStore,
                               PaymentSignalResolver paymentSignalResolver, ProofResolver proofResolver, Clock clock) {
        this.documentStore = documentStore;
        this.assignmentStore = assignmentStore;
        this.draftClaimStore = draftClaimStore;
        this.paymentSignalResolver = paymentSignalResolver;
        this.proofResolver = proofResolver;
        this.clock = clock;
    }

    public List<DraftClaim> generate(DraftClaimRange range) {
        return generate(range, Instant.now(clock));
    }

    public List<DraftClaim> generate(DraftClaimRange range, Instant now) {
        List<MedicalDocument> documents = documentStore.getAll();

        Set<String> assignedIds = assignmentStore.getAll().stream()
                .map(Assignment::documentId)
                .collect(Collectors.toSet());

        // Grows while drafts are created so one run never puts a document in two drafts
        Set<String> draftedIds = draftClaimStore.getAll().stream()
                .flatMap(d -> d.documentIds().stream())
                .collect(Collectors.toCollection(HashSet::new));

        List<MedicalDocument> candidates = documents.stream()
                .filter(d -> isEligible(d, range, now))
                .filter(d -> !assignedIds.contains(d.id()) && !draftedIds.contains(d.id()))
                .toList();

        log.info("Generating draft claims for range {}: {} candidate document(s)", range.value(), candidates.size());

        List<DraftClaim> created = new ArrayList<>();
        for (MedicalDocument document : candidates) {
            if (draftedIds.contains(document.id())) {
                continue;
            }

            Optional<DraftClaimPayment> payment = paymentSignalResolver.getPrimaryPaymentSignal(document)
                    .map(paymentSignalResolver::toPayment);
            if (payment.isEmpty()) {
                continue;
            }

            List<MedicalDocument> proofPool = documents.stream()
                    .filter(d -> !draftedIds.contains(d.id()))
                    .toList();
            List<String> proofIds = proofResolver.resolve(proofPool, document, payment.get()).stream()
                    .map(MedicalDocument::id)
                    .toList();

            DraftClaim draft = DraftClaim.builder()
                    .status(DraftClaimStatus.PENDING)
                    .primaryDocumentId(document.id())
                    .documentIds(Stream.concat(Stream.of(document.id()), proofIds.stream()).distinct().toList())
                    .payment(payment.get())
                    .paymentProofDocumentIds(proofIds)
                    .build();

            draftClaimStore.create(draft).ifPresent(d -> {
                created.add(d);
                draftedIds.addAll(d.documentIds());
            });
        }

        log.info("✓ Created {} draft claim(s)", created.size());
        return created;
    }

    private boolean isEligible(MedicalDocument document, DraftClaimRange range, Instant now) {
        return document.sourceType() == DocumentSourceType.ATTACHMENT
                && !document.isArchived()
                && BILL_LIKE.contains(document.classification())
                && paymentSignalResolver.hasPaymentSignal(document)
                && range.contains(document.date(), now);
    }
}
