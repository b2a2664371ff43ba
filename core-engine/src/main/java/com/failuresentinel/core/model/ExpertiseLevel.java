package com.failuresentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Skill level needed to carry out an action, with its hourly labor rate.
 *
 * @since 1.0.0
 */
public enum ExpertiseLevel {

    BASIC(25),
    TECHNICIAN(40),
    ENGINEER(60),
    SPECIALIST(100);

    private final double hourlyRate;

    ExpertiseLevel(double hourlyRate) {
        this.hourlyRate = hourlyRate;
    }

    public double getHourlyRate() {
        return hourlyRate;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
