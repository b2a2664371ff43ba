package com.failuresentinel.core.config;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a pattern's confidence score is derived.
 *
 * @since 1.0.0
 */
public enum ConfidenceMethod {

    STATISTICAL,
    ENSEMBLE;

    /**
     * @return lowercase configuration value
     */
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a configuration value, ignoring case and surrounding whitespace.
     *
     * @param value configuration string; must not be {@code null}
     * @return matching constant
     * @throws IllegalArgumentException if the value is unknown
     */
    public static ConfidenceMethod fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ConfidenceMethod value must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ConfidenceMethod candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ConfidenceMethod: '" + value + "'");
    }
}
