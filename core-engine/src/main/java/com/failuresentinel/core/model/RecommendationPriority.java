package com.failuresentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Priority tier of a recommendation. Declared from most to least urgent so
 * the natural order sorts high priority first.
 *
 * @since 1.0.0
 */
public enum RecommendationPriority {

    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
