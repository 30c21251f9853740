package com.expenseflow.backend.global.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings bound from the {@code expenseflow.*} namespace.
 */
@ConfigurationProperties(prefix = "expenseflow")
public record ExpenseFlowProperties(
        @DefaultValue Approval approval,
        @DefaultValue Directory directory,
        @DefaultValue Storage storage
) {

    /**
     * @param executivePositions position keywords (case-insensitive) whose holders skip supervisor review
     * @param historyLimit default page size of a supervisor's report history
     */
    public record Approval(
            @DefaultValue({"regional manager", "director", "chief", "ceo", "cfo"}) List<String> executivePositions,
            @DefaultValue("50") int historyLimit
    ) {
    }

    /**
     * External HR roster endpoint. The token is sent in the {@code token} header.
     */
    public record Directory(
            String baseUrl,
            String token,
            @DefaultValue("10s") Duration connectTimeout,
            @DefaultValue("30s") Duration readTimeout
    ) {

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank() && token != null && !token.isBlank();
        }
    }

    public record Storage(
            @DefaultValue("5") int retryAfterSeconds
    ) {
    }
}
