package com.failuresentinel.core.config;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How flagged values are treated when the baseline is recomputed.
 *
 * @since 1.0.0
 */
public enum OutlierHandling {

    /** Clip flagged values to {@code mean ± threshold·sd} and re-baseline. */
    CAP,

    /** Exclude flagged values from the baseline; they are still reported. */
    REMOVE,

    /** Leave the baseline untouched. */
    FLAG;

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
    public static OutlierHandling fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("OutlierHandling value must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (OutlierHandling candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown OutlierHandling: '" + value + "'");
    }
}
