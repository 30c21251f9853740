package com.expenseflow.backend.support;

import java.time.Duration;
import java.util.List;

import com.expenseflow.backend.global.config.ExpenseFlowProperties;

public final class TestProperties {

    private TestProperties() {
    }

    public static ExpenseFlowProperties defaults() {
        return new ExpenseFlowProperties(
                new ExpenseFlowProperties.Approval(List.of("regional manager", "director", "chief", "ceo", "cfo"), 50),
                new ExpenseFlowProperties.Directory(
                        "https://roster.example.org/api/employee",
                        "test-token",
                        Duration.ofSeconds(1),
                        Duration.ofSeconds(1)
                ),
                new ExpenseFlowProperties.Storage(7)
        );
    }
}
