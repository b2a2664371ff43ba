package com.failuresentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Building equipment categories monitored by the sensor network.
 *
 * <p>
 * Action catalogs and cost tables switch over this enum exhaustively, so
 * adding a constant here fails compilation until every table handles it.
 * </p>
 *
 * @since 1.0.0
 */
public enum EquipmentType {

    HVAC("HVAC"),
    LIGHTING("Lighting"),
    POWER("Power"),
    WATER("Water"),
    SECURITY("Security");

    private final String label;

    EquipmentType(String label) {
        this.label = label;
    }

    /**
     * @return the label used by sensor feeds and notification payloads
     */
    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Parse a feed label ({@code "HVAC"}, {@code "Lighting"}, ...) or constant
     * name, case-insensitively.
     *
     * @param value label or constant name
     * @return matching equipment type
     * @throws IllegalArgumentException if {@code value} is unknown
     */
    public static EquipmentType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (EquipmentType type : values()) {
                if (type.name().equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown equipment type: '" + value
                + "'. Supported: HVAC, Lighting, Power, Water, Security");
    }
}
