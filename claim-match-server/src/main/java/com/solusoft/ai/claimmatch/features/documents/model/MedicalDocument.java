package com.solusoft.ai.claimmatch.features.documents.model;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;

/**
 * Medical document ingested from an email, an email attachment or a calendar event.
 */
@Builder(toBuilder = true)
public record MedicalDocument(
    String id,
    DocumentSourceType sourceType,

    // Email thread the document came from; attachments of one email share it
    String emailId,
    String filename,
    String ocrText,
    String subject,
    String bodySnippet,
    String fromAddress,

    List<DetectedAmount> detectedAmounts,
    PaymentOverride paymentOverride,
    DocumentClassification classification,
    Instant date,
    List<String> medicalKeywords,

    String calendarSummary,
    String calendarLocation,
    Instant calendarStart,
    Instant calendarEnd,
    CalendarOrganizer calendarOrganizer,
    List<CalendarAttendee> calendarAttendees,

    Instant processedAt,
    Instant archivedAt
) {

    public MedicalDocument {
        detectedAmounts = detectedAmounts == null ? List.of() : List.copyOf(detectedAmounts);
        medicalKeywords = medicalKeywords == null ? List.of() : List.copyOf(medicalKeywords);
        calendarAttendees = calendarAttendees == null ? List.of() : List.copyOf(calendarAttendees);
        classification = classification == null ? DocumentClassification.UNKNOWN : classification;
    }

    @JsonIgnore
    public boolean isArchived() {
        return archivedAt != null;
    }

    @JsonIgnore
    public boolean isCalendarEvent() {
        return sourceType == DocumentSourceType.CALENDAR;
    }

    /**
     * Plain document date, falling back to the calendar start for events.
     */
    @JsonIgnore
    public Instant effectiveDate() {
        return date != null ? date : calendarStart;
    }
}
