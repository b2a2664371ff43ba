package com.failuresentinel.core.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Settings of the recommendation engine.
 *
 * <pre>
 * recommendation:
 *   budgetPolicy: filter
 *   minimumSuccessProbability: 40
 * </pre>
 *
 * @since 1.0.0
 */
public class RecommendationConfig {

    private String budgetPolicy = "flag";
    private double minimumSuccessProbability = 30.0;
    /** Months after the last maintenance at which equipment counts as overdue. */
    private int maintenanceIntervalMonths = 6;
    /** Floors at or above this number carry an access surcharge. */
    private int highFloorThreshold = 6;
    private int maxRecommendationsPerPattern = 5;

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        try {
            budgetPolicy();
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (!(minimumSuccessProbability >= 0 && minimumSuccessProbability <= 100)) {
            errors.add("'minimumSuccessProbability' must be in [0, 100], got: "
                    + minimumSuccessProbability);
        }
        if (maintenanceIntervalMonths < 1) {
            errors.add("'maintenanceIntervalMonths' must be >= 1");
        }
        if (highFloorThreshold < 1) {
            errors.add("'highFloorThreshold' must be >= 1");
        }
        if (maxRecommendationsPerPattern < 1) {
            errors.add("'maxRecommendationsPerPattern' must be >= 1");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid RecommendationConfig: " + String.join("; ", errors));
        }
    }

    /**
     * @return the parsed budget policy
     * @throws IllegalArgumentException if the configured value is unknown
     */
    public BudgetPolicy budgetPolicy() {
        return BudgetPolicy.fromValue(budgetPolicy);
    }

    public String getBudgetPolicy() {
        return budgetPolicy;
    }

    public void setBudgetPolicy(String budgetPolicy) {
        this.budgetPolicy = budgetPolicy != null ? budgetPolicy.toLowerCase(Locale.ROOT) : null;
    }

    public double getMinimumSuccessProbability() {
        return minimumSuccessProbability;
    }

    public void setMinimumSuccessProbability(double minimumSuccessProbability) {
        this.minimumSuccessProbability = minimumSuccessProbability;
    }

    public int getMaintenanceIntervalMonths() {
        return maintenanceIntervalMonths;
    }

    public void setMaintenanceIntervalMonths(int maintenanceIntervalMonths) {
        this.maintenanceIntervalMonths = maintenanceIntervalMonths;
    }

    public int getHighFloorThreshold() {
        return highFloorThreshold;
    }

    public void setHighFloorThreshold(int highFloorThreshold) {
        this.highFloorThreshold = highFloorThreshold;
    }

    public int getMaxRecommendationsPerPattern() {
        return maxRecommendationsPerPattern;
    }

    public void setMaxRecommendationsPerPattern(int maxRecommendationsPerPattern) {
        this.maxRecommendationsPerPattern = maxRecommendationsPerPattern;
    }

    @Override
    public String toString() {
        return "RecommendationConfig{" +
                "budgetPolicy='" + budgetPolicy + '\'' +
                ", minimumSuccessProbability=" + minimumSuccessProbability +
                ", maintenanceIntervalMonths=" + maintenanceIntervalMonths +
                ", highFloorThreshold=" + highFloorThreshold +
                ", maxRecommendationsPerPattern=" + maxRecommendationsPerPattern +
                '}';
    }
}
