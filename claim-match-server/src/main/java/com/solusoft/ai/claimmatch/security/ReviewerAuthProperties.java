package com.solusoft.ai.claimmatch.security;

import java.util.HashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Reviewer API keys. The map key is the reviewer name recorded on confirmed assignments.
 */
@Configuration
@ConfigurationProperties(prefix = "claimmatch.security")
public class ReviewerAuthProperties {

    private String headerName = "X-REVIEWER-KEY";

    private Map<String, Reviewer> reviewers = new HashMap<>();

    public String getHeaderName() { return headerName; }
    public void setHeaderName(String headerName) { this.headerName = headerName; }

    public Map<String, Reviewer> getReviewers() {
        return reviewers;
    }

    public void setReviewers(Map<String, Reviewer> reviewers) {
        this.reviewers = reviewers;
    }

    public static class Reviewer {
        private String key;
        private String role;

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
    }
}
