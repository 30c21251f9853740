package com.expenseflow.backend.modules.employee.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds readable employee ids such as {@code greg-weisz-3f2a9c1b} from a display name.
 */
public final class EmployeeIdGenerator {

    private static final int MAX_NAME_PARTS = 3;
    private static final int MAX_BASE_LENGTH = 20;
    private static final int SUFFIX_LENGTH = 8;

    private EmployeeIdGenerator() {
    }

    public static String fromName(String name) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, SUFFIX_LENGTH);
        String base = slug(name);
        return base.isEmpty() ? "emp-" + suffix : base + "-" + suffix;
    }

    static String slug(String name) {
        if (name == null) {
            return "";
        }
        String cleaned = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
        String joined = Arrays.stream(cleaned.split("-+"))
                .filter(part -> !part.isEmpty())
                .limit(MAX_NAME_PARTS)
                .collect(Collectors.joining("-"));
        String truncated = joined.length() > MAX_BASE_LENGTH ? joined.substring(0, MAX_BASE_LENGTH) : joined;
        return truncated.endsWith("-") ? truncated.substring(0, truncated.length() - 1) : truncated;
    }
}
