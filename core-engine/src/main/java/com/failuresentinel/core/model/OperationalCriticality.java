package com.failuresentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How essential a piece of equipment is to building operations.
 *
 * @since 1.0.0
 */
public enum OperationalCriticality {

    LOW(0.75),
    MEDIUM(1.0),
    HIGH(1.5);

    private final double savingsWeight;

    OperationalCriticality(double savingsWeight) {
        this.savingsWeight = savingsWeight;
    }

    /**
     * @return multiplier applied to avoided-downtime savings
     */
    public double getSavingsWeight() {
        return savingsWeight;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
