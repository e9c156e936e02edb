package com.solusoft.ai.claimmatch.features.drafts.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import lombok.Builder;

@Builder
@JsonClassDescription("Reviewer input required to accept a draft claim")
public record AcceptDraftClaimRequest(

    @JsonPropertyDescription("ID of the illness this claim is for")
    String illnessId,

    @JsonPropertyDescription("Doctor notes describing the treatment")
    String doctorNotes,

    @JsonPropertyDescription("Optional: treatment date (YYYY-MM-DD). Takes precedence over calendar events")
    String treatmentDate,

    @JsonPropertyDescription("Optional: calendar event document IDs; the earliest event start becomes the treatment date")
    List<String> calendarDocumentIds,

    @JsonPropertyDescription("Optional: additional proof of payment document IDs")
    List<String> paymentProofDocumentIds,

    @JsonPropertyDescription("Optional: free text describing the proof of payment")
    String paymentProofText
) {}
