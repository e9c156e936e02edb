package com.solusoft.ai.claimmatch.features.documents.model;

public record CalendarOrganizer(
    String email,
    String displayName
) {}
