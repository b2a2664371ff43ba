package com.failuresentinel.core.recommendation;

import com.failuresentinel.core.model.ActionType;
import com.failuresentinel.core.model.EquipmentType;
import com.failuresentinel.core.model.ExpertiseLevel;
import com.failuresentinel.core.model.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Maintenance actions available per equipment type.
 *
 * <p>
 * {@link #actionsFor(EquipmentType)} switches over every equipment type
 * without a default branch, so a new type does not compile until it has
 * actions. Every type gets its specific actions followed by
 * {@link #GENERIC_MONITORING}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ActionCatalog {

    static final MaintenanceAction GENERIC_MONITORING = MaintenanceAction
            .builder("generic_monitoring", ActionType.MONITORING)
            .description("Implement enhanced monitoring for {equipment} equipment {location}")
            .cost(100, 1)
            .effect(60, 0.3, 0.5)
            .build();

    // --- HVAC ---
    private static final MaintenanceAction HVAC_CALIBRATION = MaintenanceAction
            .builder("hvac_calibration", ActionType.CALIBRATION)
            .description("Calibrate {equipment} sensors and control systems {location}")
            .cost(200, 3)
            .effect(85, 0.7, 0.8)
            .build();
    private static final MaintenanceAction HVAC_CLEANING = MaintenanceAction
            .builder("hvac_cleaning", ActionType.CLEANING)
            .description("Clean {equipment} filters and coils {location}, check refrigerant levels")
            .cost(150, 2)
            .effect(75, 0.5, 0.7)
            .appliesTo(Severity.INFO, Severity.WARNING)
            .build();
    private static final MaintenanceAction HVAC_INSPECTION = MaintenanceAction
            .builder("hvac_inspection", ActionType.INSPECTION)
            .description("Comprehensive {equipment} system inspection {location} for anomalous behavior")
            .cost(100, 1.5)
            .effect(70, 0.8, 0.6)
            .build();
    private static final MaintenanceAction HVAC_COMPRESSOR_REPLACEMENT = MaintenanceAction
            .builder("hvac_compressor_replacement", ActionType.REPLACEMENT)
            .description("Replace failing {equipment} compressor assembly {location}")
            .cost(600, 6)
            .complexity(1.3)
            .expertise(ExpertiseLevel.SPECIALIST)
            .effect(88, 1.0, 0.9)
            .appliesTo(Severity.CRITICAL)
            .build();

    // --- Lighting ---
    private static final MaintenanceAction LIGHTING_REPLACEMENT = MaintenanceAction
            .builder("lighting_replacement", ActionType.REPLACEMENT)
            .description("Replace faulty {equipment} fixtures {location} showing abnormal power consumption")
            .cost(80, 1)
            .complexity(1.1)
            .expertise(ExpertiseLevel.BASIC)
            .effect(90, 0.6, 0.9)
            .appliesTo(Severity.WARNING, Severity.CRITICAL)
            .build();
    private static final MaintenanceAction LIGHTING_INSPECTION = MaintenanceAction
            .builder("lighting_inspection", ActionType.INSPECTION)
            .description("Inspect {equipment} circuits and control systems {location} for degradation")
            .cost(60, 1)
            .effect(75, 0.4, 0.7)
            .build();

    // --- Power ---
    private static final MaintenanceAction POWER_MONITORING = MaintenanceAction
            .builder("power_monitoring", ActionType.MONITORING)
            .description("Install enhanced monitoring for {equipment} distribution anomalies {location}")
            .cost(300, 4)
            .expertise(ExpertiseLevel.ENGINEER)
            .effect(85, 0.9, 0.8)
            .build();
    private static final MaintenanceAction POWER_INSPECTION = MaintenanceAction
            .builder("power_inspection", ActionType.INSPECTION)
            .description("Critical {equipment} system inspection {location} for safety and performance")
            .cost(250, 3)
            .complexity(1.2)
            .expertise(ExpertiseLevel.ENGINEER)
            .effect(90, 1.0, 0.85)
            .appliesTo(Severity.WARNING, Severity.CRITICAL)
            .build();

    // --- Water ---
    private static final MaintenanceAction WATER_LEAK_INSPECTION = MaintenanceAction
            .builder("water_leak_inspection", ActionType.INSPECTION)
            .description("Inspect {equipment} piping and pumps {location} for leaks and pressure loss")
            .cost(120, 2)
            .effect(80, 0.7, 0.75)
            .build();
    private static final MaintenanceAction WATER_VALVE_REPLACEMENT = MaintenanceAction
            .builder("water_valve_replacement", ActionType.REPLACEMENT)
            .description("Replace worn {equipment} valves and seals {location}")
            .cost(220, 3)
            .complexity(1.2)
            .effect(85, 0.8, 0.85)
            .appliesTo(Severity.WARNING, Severity.CRITICAL)
            .build();

    // --- Security ---
    private static final MaintenanceAction SECURITY_DIAGNOSTICS = MaintenanceAction
            .builder("security_diagnostics", ActionType.INSPECTION)
            .description("Run {equipment} system diagnostics {location} and verify sensor coverage")
            .cost(90, 1.5)
            .effect(80, 0.6, 0.7)
            .build();
    private static final MaintenanceAction SECURITY_CALIBRATION = MaintenanceAction
            .builder("security_calibration", ActionType.CALIBRATION)
            .description("Recalibrate {equipment} detectors {location}")
            .cost(110, 1.5)
            .effect(80, 0.6, 0.75)
            .appliesTo(Severity.WARNING, Severity.CRITICAL)
            .build();

    private ActionCatalog() {
        // utility class, not instantiable
    }

    /**
     * @param equipmentType equipment type; must not be {@code null}
     * @return specific actions for the type followed by generic monitoring
     */
    public static List<MaintenanceAction> actionsFor(EquipmentType equipmentType) {
        Objects.requireNonNull(equipmentType, "equipmentType must not be null");
        return switch (equipmentType) {
            case HVAC -> List.of(HVAC_CALIBRATION, HVAC_CLEANING, HVAC_INSPECTION,
                    HVAC_COMPRESSOR_REPLACEMENT, GENERIC_MONITORING);
            case LIGHTING -> List.of(LIGHTING_REPLACEMENT, LIGHTING_INSPECTION, GENERIC_MONITORING);
            case POWER -> List.of(POWER_MONITORING, POWER_INSPECTION, GENERIC_MONITORING);
            case WATER -> List.of(WATER_LEAK_INSPECTION, WATER_VALVE_REPLACEMENT, GENERIC_MONITORING);
            case SECURITY -> List.of(SECURITY_DIAGNOSTICS, SECURITY_CALIBRATION, GENERIC_MONITORING);
        };
    }

    /**
     * @return actions for the type that apply to the given severity
     */
    public static List<MaintenanceAction> actionsFor(EquipmentType equipmentType, Severity severity) {
        Objects.requireNonNull(severity, "severity must not be null");
        return actionsFor(equipmentType).stream()
                .filter(action -> action.appliesTo(severity))
                .toList();
    }
}
