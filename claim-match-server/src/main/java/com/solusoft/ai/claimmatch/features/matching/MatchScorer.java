package com.solusoft.ai.claimmatch.features.matching;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.springframework.stereotype.Component;

import com.solusoft.ai.claimmatch.config.MatchingProperties;
import com.solusoft.ai.claimmatch.features.assignments.model.AmountMatchDetails;
import com.solusoft.ai.claimmatch.features.assignments.model.DateMatchDetails;
import com.solusoft.ai.claimmatch.features.assignments.model.MatchReasonType;
import com.solusoft.ai.claimmatch.features.claims.model.ClaimLineItem;
import com.solusoft.ai.claimmatch.features.claims.model.InsurerClaim;
import com.solusoft.ai.claimmatch.features.documents.model.DetectedAmount;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;

/**
 * Scores one document against one insurer claim.
 *
 * <p>The score is built from three signals:
 * <ul>
 *   <li>amount: the closest detected amount in the claim currency, plus a half-weight bonus
 *       when a line item matches exactly</li>
 *   <li>date: distance in days between the document date and the nearest claim or line-item
 *       treatment date</li>
 *   <li>keywords: a document keyword found in the line-item descriptions</li>
 * </ul>
 *
 * <p>A date distance above {@link MatchingProperties#getMaxDateMismatchDays()} rejects the pair
 * whatever the amount says. Stateless; safe to call from any thread.
 */
@Component
public class MatchScorer {

    private static final long MILLIS_PER_DAY = 24L * 60 * 60 * 1000;

    private final MatchingProperties properties;

    public MatchScorer(MatchingProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the scored match, or empty when the pair is rejected or scores below the minimum
     */
    public Optional<MatchResult> score(MedicalDocument document, InsurerClaim claim) {
        List<MatchReason> reasons = new ArrayList<>();
        double total = 0;
        boolean calendarEvent = document.isCalendarEvent();

        // Amount
        AmountMatchDetails amountDetails = null;
        DetectedAmount bestAmount = calendarEvent
                ? null
                : findBestAmountMatch(document.detectedAmounts(), claim.claimAmount(), claim.claimCurrency());

        if (bestAmount != null) {
            double percent = differencePercent(bestAmount.value(), bestAmount.currency(), claim.claimAmount(), claim.claimCurrency());
            amountDetails = new AmountMatchDetails(
                    bestAmount.value(),
                    bestAmount.currency(),
                    claim.claimAmount(),
                    claim.claimCurrency(),
                    bestAmount.value().subtract(claim.claimAmount()).abs(),
                    percent);

            if (percent <= properties.getExactAmountTolerance()) {
                reasons.add(new MatchReason(MatchReasonType.EXACT_AMOUNT, properties.getExactAmountScore(),
                        "Exact amount match: %s %s matches claim %s %s".formatted(
                                bestAmount.currency(), money(bestAmount.value()), claim.claimCurrency(), money(claim.claimAmount()))));
                total += properties.getExactAmountScore();
            } else if (percent <= properties.getApproximateAmountTolerance()) {
                reasons.add(new MatchReason(MatchReasonType.APPROXIMATE_AMOUNT, properties.getApproximateAmountScore(),
                        "Approximate amount match: %s %s ≈ claim %s %s (%s%% diff)".formatted(
                                bestAmount.currency(), money(bestAmount.value()), claim.claimCurrency(), money(claim.claimAmount()),
                                String.format(Locale.ROOT, "%.1f", percent * 100))));
                total += properties.getApproximateAmountScore();
            }

            for (ClaimLineItem lineItem : claim.lineItems()) {
                DetectedAmount lineMatch = findBestAmountMatch(document.detectedAmounts(), lineItem.claimAmount(), lineItem.claimCurrency());
                if (lineMatch != null && differencePercent(lineMatch.value(), lineMatch.currency(),
                        lineItem.claimAmount(), lineItem.claimCurrency()) <= properties.getExactAmountTolerance()) {
                    double lineScore = properties.getExactAmountScore() * 0.5;
                    reasons.add(new MatchReason(MatchReasonType.EXACT_AMOUNT, lineScore,
                            "Line item match: %s %s matches \"%s\"".formatted(
                                    lineMatch.currency(), money(lineMatch.value()), lineItem.treatmentDescription())));
                    total += lineScore;
                    break;
                }
            }
        }

        // Date
        DateMatchDetails dateDetails = null;
        Instant documentDate = document.effectiveDate();
        LocalDate nearestTreatment = documentDate == null ? null : nearestTreatmentDate(documentDate, claim);

        if (documentDate != null && nearestTreatment != null) {
            long days = daysBetween(documentDate, nearestTreatment);
            dateDetails = new DateMatchDetails(documentDate, nearestTreatment, days);

            if (days > properties.getMaxDateMismatchDays()) {
                return Optional.empty();
            }

            if (days > properties.getDateMismatchPenaltyThreshold()) {
                double penalty = properties.getDateMismatchPenalty();
                reasons.add(new MatchReason(MatchReasonType.DATE_PROXIMITY, -penalty,
                        "Date mismatch penalty: document %s is %d days from nearest treatment %s".formatted(
                                toUtcDate(documentDate), days, nearestTreatment)));
                total -= penalty;
            } else if (days <= properties.getDateProximityDays()) {
                // Calendar events have no amount, so the date carries the exact-amount weight
                double baseBonus = calendarEvent ? properties.getExactAmountScore() : properties.getDateProximityBonus();
                double dateScore = days == 0 && calendarEvent
                        ? baseBonus
                        : baseBonus * (1 - (double) days / properties.getDateProximityDays());

                String description = calendarEvent
                        ? "Calendar event on %s %s treatment %s (%d days diff)".formatted(
                                toUtcDate(documentDate), days == 0 ? "matches" : "near", nearestTreatment, days)
                        : "Date proximity: document %s is %d days from treatment %s".formatted(
                                toUtcDate(documentDate), days, nearestTreatment);
                reasons.add(new MatchReason(MatchReasonType.DATE_PROXIMITY, dateScore, description));
                total += dateScore;
            }
        } else {
            double penalty = properties.getNoDatePenalty();
            reasons.add(new MatchReason(MatchReasonType.DATE_PROXIMITY, -penalty,
                    "No date found on document - temporal relevance uncertain"));
            total -= penalty;
        }

        // Keywords
        String claimDescription = claim.lineItems().stream()
                .map(ClaimLineItem::treatmentDescription)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);

        Stream<String> searchable = calendarEvent
                ? Stream.concat(document.medicalKeywords().stream(), Stream.of(document.calendarSummary(), document.calendarLocation()))
                : document.medicalKeywords().stream();

        Optional<String> keyword = searchable
                .filter(k -> k != null && !k.isEmpty())
                .filter(k -> claimDescription.contains(k.toLowerCase(Locale.ROOT)))
                .findFirst();

        if (keyword.isPresent()) {
            double keywordScore = calendarEvent ? properties.getProviderMatchBonus() * 2 : properties.getProviderMatchBonus();
            String description = calendarEvent
                    ? "Calendar event \"%s\" matches treatment description".formatted(document.calendarSummary())
                    : "Keyword match: \"%s\" found in claim description".formatted(keyword.get());
            reasons.add(new MatchReason(MatchReasonType.PROVIDER_MATCH, keywordScore, description));
            total += keywordScore;
        }

        if (total < properties.getMinimumCandidateScore()) {
            return Optional.empty();
        }

        double clamped = Math.max(0, Math.min(100, total));
        return Optional.of(new MatchResult(document.id(), claim.id(), clamped, reasons, amountDetails, dateDetails));
    }

    /**
     * Whole days between an instant and a calendar date taken at UTC midnight, rounded down
     * before taking the absolute value.
     */
    static long daysBetween(Instant documentDate, LocalDate treatmentDate) {
        long treatmentMillis = treatmentDate.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        return Math.abs(Math.floorDiv(treatmentMillis - documentDate.toEpochMilli(), MILLIS_PER_DAY));
    }

    /**
     * Relative difference against the claim amount. Different currencies are never comparable.
     */
    static double differencePercent(BigDecimal documentAmount, String documentCurrency,
                                    BigDecimal claimAmount, String claimCurrency) {
        if (documentAmount == null || claimAmount == null || !Objects.equals(documentCurrency, claimCurrency)) {
            return Double.POSITIVE_INFINITY;
        }
        BigDecimal difference = documentAmount.subtract(claimAmount).abs();
        return claimAmount.signum() > 0 ? difference.doubleValue() / claimAmount.doubleValue() : 1;
    }

    private DetectedAmount findBestAmountMatch(List<DetectedAmount> amounts, BigDecimal claimAmount, String claimCurrency) {
        DetectedAmount best = null;
        double bestPercent = Double.POSITIVE_INFINITY;
        for (DetectedAmount amount : amounts) {
            double percent = differencePercent(amount.value(), amount.currency(), claimAmount, claimCurrency);
            if (percent < bestPercent) {
                bestPercent = percent;
                best = amount;
            }
        }
        return best;
    }

    private LocalDate nearestTreatmentDate(Instant documentDate, InsurerClaim claim) {
        LocalDate nearest = claim.treatmentDate();
        long nearestDays = nearest == null ? Long.MAX_VALUE : daysBetween(documentDate, nearest);

        for (ClaimLineItem lineItem : claim.lineItems()) {
            if (lineItem.treatmentDate() == null) {
                continue;
            }
            long days = daysBetween(documentDate, lineItem.treatmentDate());
            if (days < nearestDays) {
                nearestDays = days;
                nearest = lineItem.treatmentDate();
            }
        }
        return nearest;
    }

    private static LocalDate toUtcDate(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    private static String money(BigDecimal amount) {
        return String.format(Locale.ROOT, "%.2f", amount);
    }
}
