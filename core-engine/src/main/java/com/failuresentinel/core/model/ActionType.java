package com.failuresentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of maintenance work a recommendation proposes.
 *
 * @since 1.0.0
 */
public enum ActionType {

    INSPECTION,
    CALIBRATION,
    CLEANING,
    REPLACEMENT,
    MONITORING;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
