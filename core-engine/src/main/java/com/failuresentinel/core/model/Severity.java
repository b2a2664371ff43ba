package com.failuresentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Business-relevant severity tier of a detected pattern, ordered from least
 * to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {

    INFO,
    WARNING,
    CRITICAL;

    /**
     * @param other the tier to compare against
     * @return {@code true} if this tier is {@code other} or more severe
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param value case-insensitive tier name
     * @return matching severity
     * @throws IllegalArgumentException if {@code value} is unknown
     */
    public static Severity fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value
                    + "'. Supported: info, warning, critical", e);
        }
    }
}
