package com.solusoft.ai.claimmatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "claimmatch.drafts")
public class DraftClaimProperties {

    private int proofMaxDocuments = 3;
    private int proofDateWindowDays = 30;

    // Set to false when proof of payment is checked by the caller instead
    private boolean requirePaymentProof = true;

    private String defaultCurrency = "EUR";

    public int getProofMaxDocuments() { return proofMaxDocuments; }
    public void setProofMaxDocuments(int proofMaxDocuments) { this.proofMaxDocuments = proofMaxDocuments; }
    public int getProofDateWindowDays() { return proofDateWindowDays; }
    public void setProofDateWindowDays(int proofDateWindowDays) { this.proofDateWindowDays = proofDateWindowDays; }
    public boolean isRequirePaymentProof() { return requirePaymentProof; }
    public void setRequirePaymentProof(boolean requirePaymentProof) { this.requirePaymentProof = requirePaymentProof; }
    public String getDefaultCurrency() { return defaultCurrency; }
    public void setDefaultCurrency(String defaultCurrency) { this.defaultCurrency = defaultCurrency; }
}
