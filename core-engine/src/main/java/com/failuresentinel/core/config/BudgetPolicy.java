package com.failuresentinel.core.config;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What the recommendation engine does with actions that cost more than the budget.
 *
 * @since 1.0.0
 */
public enum BudgetPolicy {

    /** Drop unaffordable actions. */
    FILTER,

    /** Keep them, marked {@code withinBudget=false}. */
    FLAG;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BudgetPolicy fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("BudgetPolicy value must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (BudgetPolicy candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown BudgetPolicy: '" + value + "'");
    }
}
