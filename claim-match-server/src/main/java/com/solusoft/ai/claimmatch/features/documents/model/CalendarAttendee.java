package com.solusoft.ai.claimmatch.features.documents.model;

public record CalendarAttendee(
    String email,
    String name,
    String response, // accepted, declined, tentative, needsAction
    boolean organizer
) {}
