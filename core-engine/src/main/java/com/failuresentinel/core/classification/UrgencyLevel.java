package com.failuresentinel.core.classification;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;

/**
 * How soon a classified pattern needs attention.
 *
 * @since 1.0.0
 */
public enum UrgencyLevel {

    IMMEDIATE(Duration.ofHours(2)),
    URGENT(Duration.ofHours(24)),
    SCHEDULED(Duration.ofDays(7)),
    MONITOR(Duration.ofDays(30));

    private final Duration responseTime;

    UrgencyLevel(Duration responseTime) {
        this.responseTime = responseTime;
    }

    /**
     * @return time within which a response is expected
     */
    public Duration getResponseTime() {
        return responseTime;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
