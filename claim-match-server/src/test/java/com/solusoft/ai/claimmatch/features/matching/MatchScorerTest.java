package com.solusoft.ai.claimmatch.features.matching;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.solusoft.ai.claimmatch.config.MatchingProperties;
import com.solusoft.ai.claimmatch.features.assignments.model.MatchReasonType;
import com.solusoft.ai.claimmatch.features.claims.model.ClaimLineItem;
import com.solusoft.ai.claimmatch.features.claims.model.InsurerClaim;
import com.solusoft.ai.claimmatch.features.documents.model.DetectedAmount;
import com.solusoft.ai.claimmatch.features.documents.model.DocumentClassification;
import com.solusoft.ai.claimmatch.features.documents.model.DocumentSourceType;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;

public class MatchScorerTest {

    private static final LocalDate TREATMENT = LocalDate.of(2024, 3, 1);

    private MatchingProperties properties;
    private MatchScorer scorer;

    @BeforeEach
    public void setup() {
        properties = new MatchingProperties();
        scorer = new MatchScorer(properties);
    }

    @Test
    public void testScore_exactAmountNearDate_createsExactAmountMatch() {
        useWideWindows();
        MedicalDocument document = bill("doc-1", Instant.parse("2024-03-11T00:00:00Z"), amount("120.00", "EUR"));
        InsurerClaim claim = claim("claim-1", "120.00", "EUR", TREATMENT);

        MatchResult result = scorer.score(document, claim).orElseThrow();

        assertEquals(MatchReasonType.EXACT_AMOUNT, result.primaryReasonType());
        assertEquals(80 + 15 * (1 - 10.0 / 45), result.score(), 0.0001);
        assertEquals(10, result.dateMatchDetails().daysDifference());
        assertEquals(0, BigDecimal.ZERO.compareTo(result.amountMatchDetails().difference()));
        assertTrue(result.reasons().stream().anyMatch(r -> r.type() == MatchReasonType.DATE_PROXIMITY && r.score() > 0));
    }

    @Test
    public void testScore_claimInOtherCurrency_neverComparesAmounts() {
        useWideWindows();
        MedicalDocument document = bill("doc-1", Instant.parse("2024-03-11T00:00:00Z"), amount("120.00", "EUR"));
        InsurerClaim claim = claim("claim-1", "120.00", "USD", TREATMENT);

        Optional<MatchResult> result = scorer.score(document, claim);

        assertTrue(result.isEmpty());
    }

    @Test
    public void testScore_dateBeyondMaxMismatch_rejectedEvenWithExactAmount() {
        useWideWindows();
        MedicalDocument document = bill("doc-1", Instant.parse("2024-09-17T00:00:00Z"), amount("120.00", "EUR"));
        InsurerClaim claim = claim("claim-1", "120.00", "EUR", TREATMENT);

        assertTrue(scorer.score(document, claim).isEmpty());
    }

    @Test
    public void testScore_approximateAmount_usesApproximateScore() {
        MedicalDocument document = bill("doc-1", Instant.parse("2024-03-01T00:00:00Z"), amount("110.00", "EUR"));
        InsurerClaim claim = claim("claim-1", "100.00", "EUR", TREATMENT);

        MatchResult result = scorer.score(document, claim).orElseThrow();

        assertEquals(MatchReasonType.APPROXIMATE_AMOUNT, result.primaryReasonType());
        assertEquals(60 + 15, result.score(), 0.0001);
        assertEquals(0.10, result.amountMatchDetails().differencePercent(), 0.0001);
    }

    @Test
    public void testScore_noDocumentDate_appliesFlatPenalty() {
        MedicalDocument document = bill("doc-1", null, amount("120.00", "EUR"));
        InsurerClaim claim = claim("claim-1", "120.00", "EUR", TREATMENT);

        MatchResult result = scorer.score(document, claim).orElseThrow();

        assertEquals(80 - 20, result.score(), 0.0001);
        assertNull(result.dateMatchDetails());
        assertTrue(result.describeReasons().contains("No date found on document"));
    }

    @Test
    public void testScore_moderateDateMismatch_appliesPenalty() {
        // 70 days: above the penalty threshold, below the rejection threshold
        MedicalDocument document = bill("doc-1", Instant.parse("2024-05-10T00:00:00Z"), amount("120.00", "EUR"));
        InsurerClaim claim = claim("claim-1", "120.00", "EUR", TREATMENT);

        Optional<MatchResult> result = scorer.score(document, claim);

        assertTrue(result.isEmpty(), "80 - 40 stays below the minimum candidate score");
    }

    @Test
    public void testScore_lineItemDateCloserThanClaimDate_usesLineItem() {
        MedicalDocument document = bill("doc-1", Instant.parse("2024-06-15T00:00:00Z"), amount("120.00", "EUR"));
        InsurerClaim claim = claim("claim-1", "120.00", "EUR", TREATMENT).toBuilder()
                .lineItems(List.of(new ClaimLineItem("Follow-up", LocalDate.of(2024, 6, 10), new BigDecimal("30.00"), "EUR")))
                .build();

        MatchResult result = scorer.score(document, claim).orElseThrow();

        assertEquals(LocalDate.of(2024, 6, 10), result.dateMatchDetails().claimDate());
        assertEquals(5, result.dateMatchDetails().daysDifference());
    }

    @Test
    public void testScore_everySignal_clampedTo100() {
        MedicalDocument document = bill("doc-1", Instant.parse("2024-03-01T00:00:00Z"), amount("120.00", "EUR")).toBuilder()
                .medicalKeywords(List.of("Physiotherapy"))
                .build();
        InsurerClaim claim = claim("claim-1", "120.00", "EUR", TREATMENT).toBuilder()
                .lineItems(List.of(new ClaimLineItem("Physiotherapy session", TREATMENT, new BigDecimal("120.00"), "EUR")))
                .build();

        MatchResult result = scorer.score(document, claim).orElseThrow();

        assertEquals(100, result.score(), 0.0001);
        assertTrue(result.reasons().stream().anyMatch(r -> r.type() == MatchReasonType.PROVIDER_MATCH));
        assertEquals(2, result.reasons().stream().filter(r -> r.type() == MatchReasonType.EXACT_AMOUNT).count());
    }

    @Test
    public void testScore_calendarEventSameDay_scoresOnDateAndSummary() {
        MedicalDocument event = MedicalDocument.builder()
                .id("cal-1")
                .sourceType(DocumentSourceType.CALENDAR)
                .classification(DocumentClassification.APPOINTMENT)
                .calendarSummary("Physiotherapy")
                .calendarStart(Instant.parse("2024-03-01T00:00:00Z"))
                .build();
        InsurerClaim claim = claim("claim-1", "120.00", "EUR", TREATMENT).toBuilder()
                .lineItems(List.of(new ClaimLineItem("Physiotherapy session", TREATMENT, new BigDecimal("120.00"), "EUR")))
                .build();

        MatchResult result = scorer.score(event, claim).orElseThrow();

        assertEquals(MatchReasonType.DATE_PROXIMITY, result.primaryReasonType());
        assertNull(result.amountMatchDetails());
        assertEquals(100, result.score(), 0.0001);
        assertTrue(result.describeReasons().contains("Calendar event \"Physiotherapy\" matches treatment description"));
    }

    @Test
    public void testScore_calendarEventNearDate_decaysFromExactAmountScore() {
        MedicalDocument event = MedicalDocument.builder()
                .id("cal-1")
                .sourceType(DocumentSourceType.CALENDAR)
                .calendarStart(Instant.parse("2024-03-04T00:00:00Z"))
                .build();

        MatchResult result = scorer.score(event, claim("claim-1", "120.00", "EUR", TREATMENT)).orElseThrow();

        assertEquals(80 * (1 - 3.0 / 30), result.score(), 0.0001);
    }

    @Test
    public void testScore_resultAlwaysWithinBounds() {
        properties.setMinimumCandidateScore(-1000);
        MedicalDocument document = bill("doc-1", Instant.parse("2024-05-10T00:00:00Z"));

        MatchResult result = scorer.score(document, claim("claim-1", "120.00", "EUR", TREATMENT)).orElseThrow();

        assertNotNull(result);
        assertTrue(result.score() >= 0 && result.score() <= 100);
    }

    @Test
    public void testDaysBetween_roundsDownBeforeAbsoluteValue() {
        assertEquals(0, MatchScorer.daysBetween(Instant.parse("2024-02-29T12:00:00Z"), TREATMENT));
        assertEquals(1, MatchScorer.daysBetween(Instant.parse("2024-03-01T09:00:00Z"), TREATMENT));
        assertEquals(10, MatchScorer.daysBetween(Instant.parse("2024-03-11T00:00:00Z"), TREATMENT));
    }

    private void useWideWindows() {
        properties.setDateProximityDays(45);
        properties.setMaxDateMismatchDays(120);
    }

    private static MedicalDocument bill(String id, Instant date, DetectedAmount... amounts) {
        return MedicalDocument.builder()
                .id(id)
                .sourceType(DocumentSourceType.ATTACHMENT)
                .classification(DocumentClassification.MEDICAL_BILL)
                .date(date)
                .detectedAmounts(List.of(amounts))
                .build();
    }

    private static DetectedAmount amount(String value, String currency) {
        return DetectedAmount.builder()
                .value(new BigDecimal(value))
                .currency(currency)
                .rawText(currency + " " + value)
                .confidence(90)
                .build();
    }

    private static InsurerClaim claim(String id, String amount, String currency, LocalDate treatmentDate) {
        return InsurerClaim.builder()
                .id(id)
                .claimNumber("CN-" + id)
                .claimAmount(new BigDecimal(amount))
                .claimCurrency(currency)
                .treatmentDate(treatmentDate)
                .build();
    }
}
