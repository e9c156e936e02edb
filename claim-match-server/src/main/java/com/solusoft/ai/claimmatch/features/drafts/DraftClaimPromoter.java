package com.solusoft.ai.claimmatch.features.drafts;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.springframework.stereotype.Service;

import com.solusoft.ai.claimmatch.config.DraftClaimProperties;
import com.solusoft.ai.claimmatch.exception.NotFoundException;
import com.solusoft.ai.claimmatch.exception.ValidationException;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;
import com.solusoft.ai.claimmatch.features.documents.repository.DocumentStore;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaim;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimPayment;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimStatus;
import com.solusoft.ai.claimmatch.features.drafts.model.PromoteDraftResult;
import com.solusoft.ai.claimmatch.features.drafts.repository.DraftClaimStore;
import com.solusoft.ai.claimmatch.features.payment.PaymentSignal;
import com.solusoft.ai.claimmatch.features.payment.PaymentSignalResolver;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a reviewer-selected document, together with the other attachments of its email,
 * into a draft claim. Works without any payment signal; the draft then starts with a zero amount.
 */
@Service
@Slf4j
public class DraftClaimPromoter {

    static final String EMPTY_PAYMENT_CONTEXT = "Manual promotion - no payment signal detected";

    private final DocumentStore documentStore;
    private final DraftClaimStore draftClaimStore;
    private final PaymentSignalResolver paymentSignalResolver;
    private final ProofResolver proofResolver;
    private final DraftClaimProperties properties;

    public DraftClaimPromoter(DocumentStore documentStore, DraftClaimStore draftClaimStore,
                              PaymentSignalResolver paymentSignalResolver, ProofResolver proofResolver,
                              DraftClaimProperties properties) {
        this.documentStore = documentStore;
        this.draftClaimStore = draftClaimStore;
        this.paymentSignalResolver = paymentSignalResolver;
        this.proofResolver = proofResolver;
        this.properties = properties;
    }

    public PromoteDraftResult promote(String documentId) {
        MedicalDocument selected = documentStore.get(documentId)
                .orElseThrow(() -> new NotFoundException("Document", documentId));

        List<MedicalDocument> active = documentStore.getAll().stream()
                .filter(d -> !d.isArchived())
                .toList();
        List<MedicalDocument> group = groupOf(selected, active);
        List<String> groupIds = group.stream().map(MedicalDocument::id).distinct().toList();

        Optional<DraftClaim> existing = draftClaimStore.getAll().stream()
                .filter(d -> d.documentIds().stream().anyMatch(groupIds::contains))
                .findFirst();

        MedicalDocument primary = selected;
        PaymentSignal best = null;
        for (MedicalDocument document : group) {
            Optional<PaymentSignal> signal = paymentSignalResolver.getPrimaryPaymentSignal(document);
            if (signal.isPresent() && (best == null || paymentSignalResolver.comparePaymentSignals(signal.get(), best) > 0)) {
                best = signal.get();
                primary = document;
            }
        }
        DraftClaimPayment payment = best != null ? paymentSignalResolver.toPayment(best) : emptyPayment();

        // Documents held by another draft cannot be proof here; the store would refuse the draft
        Set<String> heldElsewhere = draftClaimStore.getAll().stream()
                .filter(d -> existing.map(e -> !e.id().equals(d.id())).orElse(true))
                .flatMap(d -> d.documentIds().stream())
                .collect(Collectors.toSet());
        List<MedicalDocument> proofPool = active.stream()
                .filter(d -> !heldElsewhere.contains(d.id()))
                .toList();

        List<String> proofIds = proofResolver.resolve(proofPool, primary, payment).stream()
                .map(MedicalDocument::id)
                .distinct()
                .toList();

        if (existing.isPresent()) {
            return expand(existing.get(), groupIds, proofIds);
        }

        DraftClaim draft = DraftClaim.builder()
                .status(DraftClaimStatus.PENDING)
                .primaryDocumentId(primary.id())
                .documentIds(concat(groupIds, proofIds))
                .payment(payment)
                .paymentProofDocumentIds(proofIds)
                .build();

        DraftClaim created = draftClaimStore.create(draft)
                .orElseThrow(() -> new ValidationException("Documents of " + documentId + " already belong to a draft claim"));
        log.info("✓ Promoted document {} to draft claim {} ({} document(s))", documentId, created.id(), created.documentIds().size());
        return new PromoteDraftResult(created, true, false);
    }

    private PromoteDraftResult expand(DraftClaim existing, List<String> groupIds, List<String> proofIds) {
        List<String> mergedDocumentIds = concat(existing.documentIds(), concat(groupIds, proofIds));
        List<String> mergedProofIds = concat(existing.paymentProofDocumentIds(), proofIds);

        boolean documentsChanged = mergedDocumentIds.size() != existing.documentIds().size();
        boolean proofChanged = mergedProofIds.size() != existing.paymentProofDocumentIds().size();
        if (!documentsChanged && !proofChanged) {
            return new PromoteDraftResult(existing, false, false);
        }

        DraftClaim updated = draftClaimStore.update(existing.toBuilder()
                .documentIds(mergedDocumentIds)
                .paymentProofDocumentIds(mergedProofIds)
                .build());
        log.info("✓ Expanded draft claim {} to {} document(s)", updated.id(), updated.documentIds().size());
        return new PromoteDraftResult(updated, false, true);
    }

    // Attachments of the same email travel together; calendar events never do
    private List<MedicalDocument> groupOf(MedicalDocument selected, List<MedicalDocument> active) {
        if (selected.emailId() == null || selected.isCalendarEvent()) {
            return List.of(selected);
        }
        List<MedicalDocument> group = active.stream()
                .filter(d -> Objects.equals(d.emailId(), selected.emailId()) && !d.isCalendarEvent())
                .toList();
        return group.isEmpty() ? List.of(selected) : group;
    }

    private DraftClaimPayment emptyPayment() {
        return DraftClaimPayment.builder()
                .amount(BigDecimal.ZERO)
                .currency(properties.getDefaultCurrency())
                .context(EMPTY_PAYMENT_CONTEXT)
                .build();
    }

    private static List<String> concat(Collection<String> first, Collection<String> second) {
        return Stream.concat(first.stream(), second.stream()).distinct().toList();
    }
}
