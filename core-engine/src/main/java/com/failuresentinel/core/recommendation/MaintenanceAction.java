package com.failuresentinel.core.recommendation;

import com.failuresentinel.core.model.ActionType;
import com.failuresentinel.core.model.EquipmentType;
import com.failuresentinel.core.model.ExpertiseLevel;
import com.failuresentinel.core.model.Severity;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A catalog entry: one kind of maintenance work with its base cost, effort and
 * expected effect.
 *
 * <p>
 * The description template may contain {@code {equipment}} and
 * {@code {location}} placeholders.
 * </p>
 *
 * @since 1.0.0
 */
public final class MaintenanceAction {

    private final String id;
    private final ActionType actionType;
    private final String descriptionTemplate;
    private final double baseCost;
    private final double baseHours;
    private final double complexity;
    private final ExpertiseLevel requiredExpertise;
    private final double effectiveness;
    private final double urgencyMultiplier;
    private final double preventionFactor;
    private final Set<Severity> applicableSeverities;

    private MaintenanceAction(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.actionType = Objects.requireNonNull(builder.actionType, "actionType must not be null");
        this.descriptionTemplate = Objects.requireNonNull(builder.descriptionTemplate,
                "descriptionTemplate must not be null");
        this.requiredExpertise = Objects.requireNonNull(builder.requiredExpertise,
                "requiredExpertise must not be null");
        if (builder.applicableSeverities.isEmpty()) {
            throw new IllegalArgumentException("Action '" + builder.id + "' must apply to at least one severity");
        }
        this.baseCost = builder.baseCost;
        this.baseHours = builder.baseHours;
        this.complexity = builder.complexity;
        this.effectiveness = builder.effectiveness;
        this.urgencyMultiplier = builder.urgencyMultiplier;
        this.preventionFactor = builder.preventionFactor;
        this.applicableSeverities = Set.copyOf(builder.applicableSeverities);
    }

    static Builder builder(String id, ActionType actionType) {
        return new Builder(id, actionType);
    }

    static final class Builder {
        private final String id;
        private final ActionType actionType;
        private String descriptionTemplate;
        private double baseCost;
        private double baseHours;
        private double complexity = 1.0;
        private ExpertiseLevel requiredExpertise = ExpertiseLevel.TECHNICIAN;
        private double effectiveness;
        private double urgencyMultiplier;
        private double preventionFactor;
        private Set<Severity> applicableSeverities = EnumSet.allOf(Severity.class);

        private Builder(String id, ActionType actionType) {
            this.id = id;
            this.actionType = actionType;
        }

        Builder description(String descriptionTemplate) {
            this.descriptionTemplate = descriptionTemplate;
            return this;
        }

        Builder cost(double baseCost, double baseHours) {
            this.baseCost = baseCost;
            this.baseHours = baseHours;
            return this;
        }

        Builder complexity(double complexity) {
            this.complexity = complexity;
            return this;
        }

        Builder expertise(ExpertiseLevel requiredExpertise) {
            this.requiredExpertise = requiredExpertise;
            return this;
        }

        /**
         * @param effectiveness     base success rate, 0-100
         * @param urgencyMultiplier weight of the action in priority scoring
         * @param preventionFactor  share of the failure cost the action avoids
         */
        Builder effect(double effectiveness, double urgencyMultiplier, double preventionFactor) {
            this.effectiveness = effectiveness;
            this.urgencyMultiplier = urgencyMultiplier;
            this.preventionFactor = preventionFactor;
            return this;
        }

        Builder appliesTo(Severity first, Severity... rest) {
            this.applicableSeverities = EnumSet.of(first, rest);
            return this;
        }

        MaintenanceAction build() {
            return new MaintenanceAction(this);
        }
    }

    /**
     * Render the description for a pattern location.
     *
     * @param equipmentType equipment of the pattern
     * @param floorNumber   floor of the pattern, may be {@code null}
     */
    public String describe(EquipmentType equipmentType, Integer floorNumber) {
        return descriptionTemplate
                .replace("{equipment}", equipmentType.getLabel())
                .replace("{location}", floorNumber != null ? "on floor " + floorNumber : "building-wide");
    }

    public boolean appliesTo(Severity severity) {
        return applicableSeverities.contains(severity);
    }

    public String getId() {
        return id;
    }

    public ActionType getActionType() {
        return actionType;
    }

    public double getBaseCost() {
        return baseCost;
    }

    public double getBaseHours() {
        return baseHours;
    }

    public double getComplexity() {
        return complexity;
    }

    public ExpertiseLevel getRequiredExpertise() {
        return requiredExpertise;
    }

    public double getEffectiveness() {
        return effectiveness;
    }

    public double getUrgencyMultiplier() {
        return urgencyMultiplier;
    }

    public double getPreventionFactor() {
        return preventionFactor;
    }

    public Set<Severity> getApplicableSeverities() {
        return applicableSeverities;
    }

    @Override
    public String toString() {
        return "MaintenanceAction{" + id + ", " + actionType + ", baseCost=" + baseCost
                + ", baseHours=" + baseHours + ", expertise=" + requiredExpertise + '}';
    }
}
