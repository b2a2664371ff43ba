package com.failuresentinel.core.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Operational context of the equipment a set of patterns belongs to.
 *
 * <p>
 * Supplied by the caller and consumed by the recommendation engine. Only
 * {@code operationalCriticality} is required; everything else defaults to
 * "unknown" (age 0, no history, no budget, no building profile).
 * </p>
 *
 * @since 1.0.0
 */
public final class EquipmentContext {

    private final OperationalCriticality operationalCriticality;
    private final int equipmentAgeMonths;
    private final LocalDate lastMaintenanceDate;
    private final int failureHistory;
    private final Double budgetConstraint;
    private final BuildingProfile buildingProfile;

    private EquipmentContext(Builder builder) {
        this.operationalCriticality = Objects.requireNonNull(builder.operationalCriticality,
                "operationalCriticality must not be null");
        if (builder.equipmentAgeMonths < 0) {
            throw new IllegalArgumentException(
                    "equipmentAgeMonths must be >= 0, got: " + builder.equipmentAgeMonths);
        }
        if (builder.failureHistory < 0) {
            throw new IllegalArgumentException(
                    "failureHistory must be >= 0, got: " + builder.failureHistory);
        }
        if (builder.budgetConstraint != null && !(builder.budgetConstraint > 0)) {
            throw new IllegalArgumentException(
                    "budgetConstraint must be > 0 when set, got: " + builder.budgetConstraint);
        }
        this.equipmentAgeMonths = builder.equipmentAgeMonths;
        this.lastMaintenanceDate = builder.lastMaintenanceDate;
        this.failureHistory = builder.failureHistory;
        this.budgetConstraint = builder.budgetConstraint;
        this.buildingProfile = builder.buildingProfile;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a context with the given criticality and no other information
     */
    public static EquipmentContext of(OperationalCriticality criticality) {
        return builder().operationalCriticality(criticality).build();
    }

    public static class Builder {
        private OperationalCriticality operationalCriticality = OperationalCriticality.MEDIUM;
        private int equipmentAgeMonths;
        private LocalDate lastMaintenanceDate;
        private int failureHistory;
        private Double budgetConstraint;
        private BuildingProfile buildingProfile;

        public Builder operationalCriticality(OperationalCriticality operationalCriticality) {
            this.operationalCriticality = operationalCriticality;
            return this;
        }

        public Builder equipmentAgeMonths(int equipmentAgeMonths) {
            this.equipmentAgeMonths = equipmentAgeMonths;
            return this;
        }

        public Builder lastMaintenanceDate(LocalDate lastMaintenanceDate) {
            this.lastMaintenanceDate = lastMaintenanceDate;
            return this;
        }

        public Builder failureHistory(int failureHistory) {
            this.failureHistory = failureHistory;
            return this;
        }

        public Builder budgetConstraint(Double budgetConstraint) {
            this.budgetConstraint = budgetConstraint;
            return this;
        }

        public Builder buildingProfile(BuildingProfile buildingProfile) {
            this.buildingProfile = buildingProfile;
            return this;
        }

        public EquipmentContext build() {
            return new EquipmentContext(this);
        }
    }

    public OperationalCriticality getOperationalCriticality() {
        return operationalCriticality;
    }

    public int getEquipmentAgeMonths() {
        return equipmentAgeMonths;
    }

    public Optional<LocalDate> getLastMaintenanceDate() {
        return Optional.ofNullable(lastMaintenanceDate);
    }

    public int getFailureHistory() {
        return failureHistory;
    }

    public Optional<Double> getBudgetConstraint() {
        return Optional.ofNullable(budgetConstraint);
    }

    public Optional<BuildingProfile> getBuildingProfile() {
        return Optional.ofNullable(buildingProfile);
    }

    @Override
    public String toString() {
        return "EquipmentContext{" +
                "criticality=" + operationalCriticality +
                ", ageMonths=" + equipmentAgeMonths +
                ", lastMaintenance=" + lastMaintenanceDate +
                ", failureHistory=" + failureHistory +
                ", budget=" + budgetConstraint +
                ", building=" + buildingProfile +
                '}';
    }
}
