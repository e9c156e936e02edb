package com.solusoft.ai.claimmatch.features.drafts;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.springframework.stereotype.Component;

import com.solusoft.ai.claimmatch.config.DraftClaimProperties;
import com.solusoft.ai.claimmatch.features.documents.model.DocumentClassification;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimPayment;
import com.solusoft.ai.claimmatch.features.payment.PaymentSignalResolver;

/**
 * Picks the documents most likely to prove that a draft claim's payment was made,
 * e.g. a bank transfer confirmation or a receipt for the same amount.
 *
 * <p>Scoring per candidate: amount match +4, receipt +2, proof keywords +2,
 * same email thread +1, dated within the window +1. As soon as one candidate matches
 * the amount, candidates without an amount match are dropped.
 */
@Component
public class ProofResolver {

    static final List<String> PROOF_KEYWORDS = List.of(
            "proof of payment",
            "payment received",
            "payment confirmation",
            "paid",
            "bank transfer",
            "transfer",
            "sent",
            "transaction",
            "monzo");

    private static final BigDecimal AMOUNT_TOLERANCE = new BigDecimal("0.01");

    private final PaymentSignalResolver paymentSignalResolver;
    private final DraftClaimProperties properties;

    public ProofResolver(PaymentSignalResolver paymentSignalResolver, DraftClaimProperties properties) {
        this.paymentSignalResolver = paymentSignalResolver;
        this.properties = properties;
    }

    public List<MedicalDocument> resolve(List<MedicalDocument> documents, MedicalDocument primary, DraftClaimPayment payment) {
        int limit = properties.getProofMaxDocuments();
        if (limit <= 0) {
            return List.of();
        }

        Instant referenceDate = proofDate(primary);

        List<ScoredProof> scored = documents.stream()
                .filter(d -> !Objects.equals(d.id(), primary.id()))
                .filter(this::isProofCandidate)
                .map(d -> score(d, primary, payment, referenceDate))
                .filter(p -> p.score() > 0)
                .toList();

        boolean anyAmountMatch = scored.stream().anyMatch(ScoredProof::amountMatch);

        return scored.stream()
                .filter(p -> !anyAmountMatch || p.amountMatch())
                .sorted(Comparator.comparingInt(ScoredProof::score).reversed())
                .limit(limit)
                .map(ScoredProof::document)
                .toList();
    }

    private ScoredProof score(MedicalDocument document, MedicalDocument primary, DraftClaimPayment payment, Instant referenceDate) {
        boolean amountMatch = matchesPaymentAmount(document, payment);
        boolean receipt = document.classification() == DocumentClassification.RECEIPT;
        boolean keywords = hasProofKeywords(proofText(document));
        boolean sameEmail = primary.emailId() != null && primary.emailId().equals(document.emailId());
        boolean inWindow = isWithinWindow(referenceDate, proofDate(document));

        int score = (amountMatch ? 4 : 0)
                + (receipt ? 2 : 0)
                + (keywords ? 2 : 0)
                + (sameEmail ? 1 : 0)
                + (inWindow ? 1 : 0);
        return new ScoredProof(document, score, amountMatch);
    }

    private boolean isProofCandidate(MedicalDocument document) {
        if (document.isArchived() || document.isCalendarEvent()) {
            return false;
        }
        return document.classification() == DocumentClassification.RECEIPT || hasProofKeywords(proofText(document));
    }

    private boolean matchesPaymentAmount(MedicalDocument document, DraftClaimPayment payment) {
        if (payment.amount() == null || payment.amount().signum() <= 0) {
            return false;
        }
        return paymentSignalResolver.getPaymentSignals(document).stream()
                .anyMatch(signal -> Objects.equals(signal.currency(), payment.currency())
                        && signal.amount() != null
                        && signal.amount().subtract(payment.amount()).abs().compareTo(AMOUNT_TOLERANCE) < 0);
    }

    private boolean isWithinWindow(Instant reference, Instant candidate) {
        if (reference == null || candidate == null) {
            return false;
        }
        Duration distance = Duration.between(reference, candidate).abs();
        return distance.compareTo(Duration.ofDays(properties.getProofDateWindowDays())) <= 0;
    }

    private static Instant proofDate(MedicalDocument document) {
        return document.date() != null ? document.date() : document.processedAt();
    }

    private static String proofText(MedicalDocument document) {
        return Stream.of(document.subject(), document.bodySnippet(), document.ocrText(), document.filename(), document.fromAddress())
                .filter(s -> s != null && !s.isEmpty())
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
    }

    private static boolean hasProofKeywords(String text) {
        return PROOF_KEYWORDS.stream().anyMatch(text::contains);
    }

    private record ScoredProof(MedicalDocument document, int score, boolean amountMatch) {}
}
