package com.failuresentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A prioritized, costed maintenance action proposed for one pattern.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>{@code estimatedCost}, {@code estimatedSavings} and
 * {@code timeToImplementHours} are strictly positive</li>
 * <li>{@code successProbability} lies in {@code [0, 100]}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class Recommendation {

    private final String actionId;
    private final String patternId;
    private final ActionType actionType;
    private final RecommendationPriority priority;
    private final double estimatedCost;
    private final double estimatedSavings;
    private final double timeToImplementHours;
    private final double successProbability;
    private final ExpertiseLevel requiredExpertise;
    private final boolean withinBudget;
    private final String description;

    private Recommendation(Builder builder) {
        this.actionId = Objects.requireNonNull(builder.actionId, "actionId must not be null");
        this.patternId = Objects.requireNonNull(builder.patternId, "patternId must not be null");
        this.actionType = Objects.requireNonNull(builder.actionType, "actionType must not be null");
        this.priority = Objects.requireNonNull(builder.priority, "priority must not be null");
        this.requiredExpertise = Objects.requireNonNull(builder.requiredExpertise,
                "requiredExpertise must not be null");
        requirePositive("estimatedCost", builder.estimatedCost);
        requirePositive("estimatedSavings", builder.estimatedSavings);
        requirePositive("timeToImplementHours", builder.timeToImplementHours);
        if (!(builder.successProbability >= 0 && builder.successProbability <= 100)) {
            throw new IllegalArgumentException(
                    "successProbability must be in [0, 100], got: " + builder.successProbability);
        }
        this.estimatedCost = builder.estimatedCost;
        this.estimatedSavings = builder.estimatedSavings;
        this.timeToImplementHours = builder.timeToImplementHours;
        this.successProbability = builder.successProbability;
        this.withinBudget = builder.withinBudget;
        this.description = builder.description != null ? builder.description : "";
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + value);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String actionId;
        private String patternId;
        private ActionType actionType;
        private RecommendationPriority priority;
        private double estimatedCost;
        private double estimatedSavings;
        private double timeToImplementHours;
        private double successProbability;
        private ExpertiseLevel requiredExpertise;
        private boolean withinBudget = true;
        private String description;

        public Builder actionId(String actionId) {
            this.actionId = actionId;
            return this;
        }

        public Builder patternId(String patternId) {
            this.patternId = patternId;
            return this;
        }

        public Builder actionType(ActionType actionType) {
            this.actionType = actionType;
            return this;
        }

        public Builder priority(RecommendationPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder estimatedCost(double estimatedCost) {
            this.estimatedCost = estimatedCost;
            return this;
        }

        public Builder estimatedSavings(double estimatedSavings) {
            this.estimatedSavings = estimatedSavings;
            return this;
        }

        public Builder timeToImplementHours(double timeToImplementHours) {
            this.timeToImplementHours = timeToImplementHours;
            return this;
        }

        public Builder successProbability(double successProbability) {
            this.successProbability = successProbability;
            return this;
        }

        public Builder requiredExpertise(ExpertiseLevel requiredExpertise) {
            this.requiredExpertise = requiredExpertise;
            return this;
        }

        public Builder withinBudget(boolean withinBudget) {
            this.withinBudget = withinBudget;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Recommendation build() {
            return new Recommendation(this);
        }
    }

    /**
     * @return return on investment, {@code (savings - cost) / cost}
     */
    @JsonProperty("roi")
    public double roi() {
        return (estimatedSavings - estimatedCost) / estimatedCost;
    }

    public String getActionId() {
        return actionId;
    }

    public String getPatternId() {
        return patternId;
    }

    public ActionType getActionType() {
        return actionType;
    }

    public RecommendationPriority getPriority() {
        return priority;
    }

    public double getEstimatedCost() {
        return estimatedCost;
    }

    public double getEstimatedSavings() {
        return estimatedSavings;
    }

    public double getTimeToImplementHours() {
        return timeToImplementHours;
    }

    public double getSuccessProbability() {
        return successProbability;
    }

    public ExpertiseLevel getRequiredExpertise() {
        return requiredExpertise;
    }

    /**
     * @return {@code false} when the cost exceeds the context's budget
     */
    public boolean isWithinBudget() {
        return withinBudget;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "Recommendation{" +
                "actionId='" + actionId + '\'' +
                ", patternId='" + patternId + '\'' +
                ", priority=" + priority +
                ", cost=" + estimatedCost +
                ", savings=" + estimatedSavings +
                ", successProbability=" + successProbability +
                ", withinBudget=" + withinBudget +
                '}';
    }
}
