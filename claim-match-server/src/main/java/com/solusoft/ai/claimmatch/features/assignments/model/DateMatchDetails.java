package com.solusoft.ai.claimmatch.features.assignments.model;

import java.time.Instant;
import java.time.LocalDate;

public record DateMatchDetails(
    Instant documentDate,
    LocalDate claimDate,
    long daysDifference
) {}
