package com.failuresentinel.core.classification;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Temporal shape of a detected pattern.
 *
 * @since 1.0.0
 */
public enum ClassifiedPatternType {

    /** One or two anomalous readings. */
    SUDDEN_SPIKE,

    /** Severity rising steadily across the pattern. */
    GRADUAL_DEGRADATION,

    /** Anomalous readings at irregular intervals. */
    INTERMITTENT_FAILURE,

    /** Evenly spaced, persistent deviation. */
    SUSTAINED_FAILURE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
