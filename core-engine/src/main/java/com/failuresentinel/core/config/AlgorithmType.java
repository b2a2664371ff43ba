package com.failuresentinel.core.config;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Anomaly detection algorithm selected by {@link DetectorConfig}.
 *
 * @since 1.0.0
 */
public enum AlgorithmType {

    /** Z-score of each reading, optionally against a seasonal profile. */
    STATISTICAL_ZSCORE,

    /** Linear trend and seasonal profile removed before z-scoring. */
    SEASONAL_DECOMPOSITION;

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
    public static AlgorithmType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("AlgorithmType value must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (AlgorithmType candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown AlgorithmType: '" + value + "'");
    }
}
