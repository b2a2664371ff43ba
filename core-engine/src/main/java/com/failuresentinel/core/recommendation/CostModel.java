package com.failuresentinel.core.recommendation;

import com.failuresentinel.core.model.EquipmentType;
import com.failuresentinel.core.model.OperationalCriticality;
import com.failuresentinel.core.model.Severity;

/**
 * Cost-benefit lookup tables, keyed by enum so every switch is exhaustive.
 */
final class CostModel {

    private CostModel() {
        // utility class, not instantiable
    }

    /** Multiplier on the 1000-unit cost of an equipment failure. */
    static double failureCostMultiplier(EquipmentType type) {
        return switch (type) {
            case HVAC -> 3.0;
            case POWER -> 5.0;
            case LIGHTING -> 1.5;
            case WATER -> 2.0;
            case SECURITY -> 2.5;
        };
    }

    static double downtimeCostPerHour(EquipmentType type) {
        return switch (type) {
            case HVAC -> 200;
            case POWER -> 500;
            case LIGHTING -> 100;
            case WATER -> 150;
            case SECURITY -> 300;
        };
    }

    static double equipmentCostMultiplier(EquipmentType type) {
        return switch (type) {
            case HVAC -> 1.3;
            case POWER -> 1.4;
            case LIGHTING -> 1.0;
            case WATER -> 1.1;
            case SECURITY -> 0.9;
        };
    }

    static double reliabilityFactor(EquipmentType type) {
        return switch (type) {
            case HVAC -> 0.95;
            case POWER -> 0.9;
            case LIGHTING -> 1.0;
            case WATER -> 0.95;
            case SECURITY -> 1.05;
        };
    }

    static double severityCostMultiplier(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 1.5;
            case WARNING -> 1.2;
            case INFO -> 1.0;
        };
    }

    /** Hours of downtime an action avoids for a pattern of this severity. */
    static double avoidedDowntimeHours(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 24;
            case WARNING -> 8;
            case INFO -> 2;
        };
    }

    static double severityPriorityPoints(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 40;
            case WARNING -> 25;
            case INFO -> 10;
        };
    }

    static double criticalityPriorityPoints(OperationalCriticality criticality) {
        return switch (criticality) {
            case HIGH -> 10;
            case MEDIUM -> 5;
            case LOW -> 2;
        };
    }
}
