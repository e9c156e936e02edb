package com.solusoft.ai.claimmatch.features.payment;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.solusoft.ai.claimmatch.features.documents.model.DetectedAmount;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;
import com.solusoft.ai.claimmatch.features.documents.model.PaymentOverride;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimPayment;

/**
 * Resolves the payment signals of a document. A manual override always wins and
 * hides every detected amount while it exists.
 */
@Component
public class PaymentSignalResolver {

    private static final int OVERRIDE_CONFIDENCE = 100;

    /**
     * Highest confidence first, then the larger amount.
     */
    private static final Comparator<PaymentSignal> PRIMARY_ORDER = Comparator
            .comparingInt(PaymentSignal::confidence)
            .thenComparing(PaymentSignal::amount);

    public List<PaymentSignal> getPaymentSignals(MedicalDocument document) {
        if (document.paymentOverride() != null) {
            return List.of(fromOverride(document.paymentOverride()));
        }
        return document.detectedAmounts().stream()
                .map(this::fromDetected)
                .toList();
    }

    public boolean hasPaymentSignal(MedicalDocument document) {
        return document.paymentOverride() != null || !document.detectedAmounts().isEmpty();
    }

    public Optional<PaymentSignal> getPrimaryPaymentSignal(MedicalDocument document) {
        return getPaymentSignals(document).stream().max(PRIMARY_ORDER);
    }

    /**
     * Orders signals coming from different documents: override beats detected,
     * then confidence, then amount. Positive when {@code a} is the stronger signal.
     */
    public int comparePaymentSignals(PaymentSignal a, PaymentSignal b) {
        if (a.source() != b.source()) {
            return Integer.compare(a.source().priority(), b.source().priority());
        }
        return PRIMARY_ORDER.compare(a, b);
    }

    /**
     * Copies a signal into the immutable payment snapshot stored on a draft claim.
     */
    public DraftClaimPayment toPayment(PaymentSignal signal) {
        return DraftClaimPayment.builder()
                .amount(signal.amount())
                .currency(signal.currency())
                .source(signal.source())
                .rawText(signal.rawText())
                .context(signal.context())
                .confidence(signal.confidence())
                .overrideNote(signal.overrideNote())
                .overrideUpdatedAt(signal.overrideUpdatedAt())
                .build();
    }

    private PaymentSignal fromOverride(PaymentOverride override) {
        return PaymentSignal.builder()
                .amount(override.amount())
                .currency(override.currency())
                .rawText("Override: " + override.amount().toPlainString() + " " + override.currency())
                .context(override.note())
                .confidence(OVERRIDE_CONFIDENCE)
                .source(PaymentSignalSource.OVERRIDE)
                .overrideNote(override.note())
                .overrideUpdatedAt(override.updatedAt())
                .build();
    }

    private PaymentSignal fromDetected(DetectedAmount amount) {
        return PaymentSignal.builder()
                .amount(amount.value())
                .currency(amount.currency())
                .rawText(amount.rawText())
                .context(amount.context())
                .confidence(amount.confidence())
                .source(PaymentSignalSource.DETECTED)
                .build();
    }
}
