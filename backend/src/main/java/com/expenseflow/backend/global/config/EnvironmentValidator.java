package com.expenseflow.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks required settings once the application is up.
 * A missing datasource is fatal; a missing HR directory only disables sync.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "server.port"
    };

    private final Environment environment;
    private final ExpenseFlowProperties properties;

    public EnvironmentValidator(Environment environment, ExpenseFlowProperties properties) {
        this.environment = environment;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missing.add(key);
            }
        }

        List<String> invalid = new ArrayList<>();
        if (properties.approval().historyLimit() < 1) {
            invalid.add("expenseflow.approval.history-limit must be positive");
        }
        if (properties.storage().retryAfterSeconds() < 0) {
            invalid.add("expenseflow.storage.retry-after-seconds must be >= 0");
        }

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            log.error("Environment validation failed. missing={}, invalid={}", missing, invalid);
            throw new IllegalStateException("Environment validation failed: missing=" + missing + ", invalid=" + invalid);
        }

        if (!properties.directory().isConfigured()) {
            log.warn("External HR directory is not configured (expenseflow.directory.base-url / token); sync endpoints will answer 503");
        }
        log.info("Environment validation passed");
    }
}
