package com.solusoft.ai.claimmatch.features.drafts;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

import org.springframework.stereotype.Service;

import com.solusoft.ai.claimmatch.config.DraftClaimProperties;
import com.solusoft.ai.claimmatch.exception.NotFoundException;
import com.solusoft.ai.claimmatch.exception.ValidationException;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;
import com.solusoft.ai.claimmatch.features.documents.repository.DocumentStore;
import com.solusoft.ai.claimmatch.features.drafts.model.AcceptDraftClaimRequest;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaim;
import com.solusoft.ai.claimmatch.features.drafts.model.DraftClaimStatus;
import com.solusoft.ai.claimmatch.features.drafts.model.TreatmentDateSource;
import com.solusoft.ai.claimmatch.features.drafts.repository.DraftClaimStore;
import com.solusoft.ai.claimmatch.features.illnesses.repository.IllnessStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Accept, reject and re-open transitions of a draft claim.
 *
 * <p>Every check runs before the single store write, so a failed call leaves the draft as it was.
 */
@Service
@Slf4j
public class DraftClaimLifecycle {

    private final DraftClaimStore draftClaimStore;
    private final DocumentStore documentStore;
    private final IllnessStore illnessStore;
    private final DraftClaimProperties properties;
    private final Clock clock;

    public DraftClaimLifecycle(DraftClaimStore draftClaimStore, DocumentStore documentStore, IllnessStore illnessStore,
                               DraftClaimProperties properties, Clock clock) {
        this.draftClaimStore = draftClaimStore;
        this.documentStore = documentStore;
        this.illnessStore = illnessStore;
        this.properties = properties;
        this.clock = clock;
    }

    public DraftClaim accept(String draftId, AcceptDraftClaimRequest request) {
        if (isBlank(request.illnessId())) {
            throw new ValidationException("illnessId is required to accept a draft claim");
        }
        if (isBlank(request.doctorNotes())) {
            throw new ValidationException("doctorNotes is required to accept a draft claim");
        }

        DraftClaim draft = load(draftId);
        illnessStore.get(request.illnessId())
                .orElseThrow(() -> new NotFoundException("Illness", request.illnessId()));
        requireTransition(draft, DraftClaimStatus.ACCEPTED);

        List<String> calendarIds = cleanIds(request.calendarDocumentIds());

        List<String> requestedProofIds = cleanIds(request.paymentProofDocumentIds());
        for (String proofId : requestedProofIds) {
            documentStore.get(proofId).orElseThrow(() -> new NotFoundException("Document", proofId));
        }

        // Calendar ids are only resolved when they supply the date; a manual date wins
        TreatmentDateSource dateSource;
        LocalDate treatmentDate;
        if (!isBlank(request.treatmentDate())) {
            treatmentDate = parseTreatmentDate(request.treatmentDate().trim());
            dateSource = TreatmentDateSource.MANUAL;
        } else if (!calendarIds.isEmpty()) {
            treatmentDate = earliestCalendarDate(loadCalendarDocuments(calendarIds))
                    .orElseThrow(() -> new ValidationException("No usable dates found in calendar documents"));
            dateSource = TreatmentDateSource.CALENDAR;
        } else {
            throw new ValidationException("treatmentDate or calendarDocumentIds is required to accept a draft claim");
        }

        List<String> proofIds = Stream.concat(draft.paymentProofDocumentIds().stream(), requestedProofIds.stream())
                .distinct()
                .toList();
        String proofText = !isBlank(request.paymentProofText()) ? request.paymentProofText().trim() : draft.paymentProofText();

        if (properties.isRequirePaymentProof() && proofIds.isEmpty() && isBlank(proofText)) {
            throw new ValidationException("Payment proof is required: add proof documents or describe the proof of payment");
        }

        Instant now = Instant.now(clock);
        DraftClaim accepted = draft.toBuilder()
                .status(DraftClaimStatus.ACCEPTED)
                .illnessId(request.illnessId())
                .doctorNotes(request.doctorNotes().trim())
                .treatmentDate(treatmentDate)
                .treatmentDateSource(dateSource)
                .calendarDocumentIds(calendarIds.isEmpty() ? draft.calendarDocumentIds() : calendarIds)
                .paymentProofDocumentIds(proofIds)
                .paymentProofText(proofText)
                .documentIds(Stream.of(draft.documentIds(), calendarIds, proofIds)
                        .flatMap(Collection::stream)
                        .distinct()
                        .toList())
                .acceptedAt(now)
                .build();

        DraftClaim saved = draftClaimStore.update(accepted);
        log.info("✓ Draft claim {} accepted for illness {} (treatment {} from {})",
                draftId, request.illnessId(), treatmentDate, dateSource.value());
        return saved;
    }

    public DraftClaim reject(String draftId) {
        DraftClaim draft = load(draftId);
        requireTransition(draft, DraftClaimStatus.REJECTED);

        DraftClaim saved = draftClaimStore.update(draft.toBuilder()
                .status(DraftClaimStatus.REJECTED)
                .rejectedAt(Instant.now(clock))
                .build());
        log.info("✓ Draft claim {} rejected", draftId);
        return saved;
    }

    /**
     * Re-opens an accepted or rejected draft. Acceptance fields are kept for the next review.
     */
    public DraftClaim markPending(String draftId) {
        DraftClaim draft = load(draftId);
        requireTransition(draft, DraftClaimStatus.PENDING);

        DraftClaim saved = draftClaimStore.update(draft.toBuilder().status(DraftClaimStatus.PENDING).build());
        log.info("✓ Draft claim {} moved back to pending", draftId);
        return saved;
    }

    /**
     * Accepts {@code YYYY-MM-DD} or an ISO date-time; date-times are read in UTC.
     */
    static LocalDate parseTreatmentDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException notADate) {
            try {
                return OffsetDateTime.parse(value).atZoneSameInstant(ZoneOffset.UTC).toLocalDate();
            } catch (DateTimeParseException notAnOffsetDateTime) {
                try {
                    return LocalDateTime.parse(value).toLocalDate();
                } catch (DateTimeParseException e) {
                    throw new ValidationException("treatmentDate must be a valid date: " + value);
                }
            }
        }
    }

    private List<MedicalDocument> loadCalendarDocuments(List<String> calendarIds) {
        List<MedicalDocument> calendarDocuments = new ArrayList<>();
        for (String calendarId : calendarIds) {
            MedicalDocument document = documentStore.get(calendarId)
                    .orElseThrow(() -> new NotFoundException("Calendar document", calendarId));
            if (!document.isCalendarEvent()) {
                throw new ValidationException("calendarDocumentIds must be calendar documents: " + calendarId + " is "
                        + document.sourceType().value());
            }
            calendarDocuments.add(document);
        }
        return calendarDocuments;
    }

    private Optional<LocalDate> earliestCalendarDate(List<MedicalDocument> calendarDocuments) {
        return calendarDocuments.stream()
                .map(d -> d.calendarStart() != null ? d.calendarStart() : d.date())
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .map(start -> start.atZone(ZoneOffset.UTC).toLocalDate());
    }

    private DraftClaim load(String draftId) {
        return draftClaimStore.get(draftId).orElseThrow(() -> new NotFoundException("Draft claim", draftId));
    }

    private void requireTransition(DraftClaim draft, DraftClaimStatus target) {
        if (!draft.status().canTransitionTo(target)) {
            throw new ValidationException("Draft claim " + draft.id() + " cannot move from "
                    + draft.status().value() + " to " + target.value());
        }
    }

    private static List<String> cleanIds(List<String> ids) {
        if (ids == null) {
            return List.of();
        }
        return ids.stream().filter(id -> !isBlank(id)).distinct().toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
