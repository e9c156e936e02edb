package com.solusoft.ai.claimmatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Scoring thresholds for document to claim matching.
 * Tolerances are fractions of the claim amount (0.01 = 1%), windows are in days.
 */
@Configuration
@ConfigurationProperties(prefix = "claimmatch.matching")
public class MatchingProperties {

    private double exactAmountTolerance = 0.01;
    private double approximateAmountTolerance = 0.10;
    private double exactAmountScore = 80;
    private double approximateAmountScore = 60;

    private int dateProximityDays = 30;
    private int dateMismatchPenaltyThreshold = 60;
    private int maxDateMismatchDays = 90;
    private double dateMismatchPenalty = 40;
    private double noDatePenalty = 20;
    private double dateProximityBonus = 15;
    private double providerMatchBonus = 10;

    private double minimumCandidateScore = 50;
    private int maxCandidatesPerDocument = 5;
    private boolean clearExistingCandidates = true;

    public double getExactAmountTolerance() { return exactAmountTolerance; }
    public void setExactAmountTolerance(double exactAmountTolerance) { this.exactAmountTolerance = exactAmountTolerance; }
    public double getApproximateAmountTolerance() { return approximateAmountTolerance; }
    public void setApproximateAmountTolerance(double approximateAmountTolerance) { this.approximateAmountTolerance = approximateAmountTolerance; }
    public double getExactAmountScore() { return exactAmountScore; }
    public void setExactAmountScore(double exactAmountScore) { this.exactAmountScore = exactAmountScore; }
    public double getApproximateAmountScore() { return approximateAmountScore; }
    public void setApproximateAmountScore(double approximateAmountScore) { this.approximateAmountScore = approximateAmountScore; }
    public int getDateProximityDays() { return dateProximityDays; }
    public void setDateProximityDays(int dateProximityDays) { this.dateProximityDays = dateProximityDays; }
    public int getDateMismatchPenaltyThreshold() { return dateMismatchPenaltyThreshold; }
    public void setDateMismatchPenaltyThreshold(int dateMismatchPenaltyThreshold) { this.dateMismatchPenaltyThreshold = dateMismatchPenaltyThreshold; }
    public int getMaxDateMismatchDays() { return maxDateMismatchDays; }
    public void setMaxDateMismatchDays(int maxDateMismatchDays) { this.maxDateMismatchDays = maxDateMismatchDays; }
    public double getDateMismatchPenalty() { return dateMismatchPenalty; }
    public void setDateMismatchPenalty(double dateMismatchPenalty) { this.dateMismatchPenalty = dateMismatchPenalty; }
    public double getNoDatePenalty() { return noDatePenalty; }
    public void setNoDatePenalty(double noDatePenalty) { this.noDatePenalty = noDatePenalty; }
    public double getDateProximityBonus() { return dateProximityBonus; }
    public void setDateProximityBonus(double dateProximityBonus) { this.dateProximityBonus = dateProximityBonus; }
    public double getProviderMatchBonus() { return providerMatchBonus; }
    public void setProviderMatchBonus(double providerMatchBonus) { this.providerMatchBonus = providerMatchBonus; }
    public double getMinimumCandidateScore() { return minimumCandidateScore; }
    public void setMinimumCandidateScore(double minimumCandidateScore) { this.minimumCandidateScore = minimumCandidateScore; }
    public int getMaxCandidatesPerDocument() { return maxCandidatesPerDocument; }
    public void setMaxCandidatesPerDocument(int maxCandidatesPerDocument) { this.maxCandidatesPerDocument = maxCandidatesPerDocument; }
    public boolean isClearExistingCandidates() { return clearExistingCandidates; }
    public void setClearExistingCandidates(boolean clearExistingCandidates) { this.clearExistingCandidates = clearExistingCandidates; }
}
