package com.failuresentinel.core.recommendation;

import com.failuresentinel.core.config.BudgetPolicy;
import com.failuresentinel.core.config.RecommendationConfig;
import com.failuresentinel.core.model.BuildingProfile;
import com.failuresentinel.core.model.DetectedPattern;
import com.failuresentinel.core.model.EquipmentContext;
import com.failuresentinel.core.model.ExpertiseLevel;
import com.failuresentinel.core.model.OperationalCriticality;
import com.failuresentinel.core.model.PatternWithRecommendations;
import com.failuresentinel.core.model.Recommendation;
import com.failuresentinel.core.model.RecommendationPriority;
import com.failuresentinel.core.model.Severity;
import com.failuresentinel.core.util.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns detected patterns into prioritized, costed maintenance actions.
 *
 * <h3>Estimates</h3>
 * <ul>
 * <li><b>Cost</b> grows with action complexity, labor, severity, equipment
 * type and age, high criticality and overdue maintenance; high floors add an
 * access surcharge.</li>
 * <li><b>Savings</b> combine avoided downtime, weighted by criticality and
 * failure history, with the avoided failure cost.</li>
 * <li><b>Success probability</b> rises with detection confidence and falls
 * with equipment age and failure history; capped at 95.</li>
 * </ul>
 *
 * <h3>Ordering</h3>
 * <p>
 * Priority (high first), then affordable before over-budget, then ROI, then
 * success probability.
 * </p>
 *
 * @since 1.0.0
 */
public class RecommendationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RecommendationEngine.class);

    static final double MAX_SUCCESS_PROBABILITY = 95.0;
    static final double HIGH_FLOOR_SURCHARGE = 50.0;

    private static final Comparator<Recommendation> ORDER = Comparator
            .comparing(Recommendation::getPriority)
            .thenComparing(Recommendation::isWithinBudget, Comparator.reverseOrder())
            .thenComparing(Comparator.comparingDouble(Recommendation::roi).reversed())
            .thenComparing(Comparator.comparingDouble(Recommendation::getSuccessProbability).reversed())
            .thenComparing(Recommendation::getActionId);

    private final RecommendationConfig config;
    private final Clock clock;

    public RecommendationEngine() {
        this(new RecommendationConfig(), Clock.systemUTC());
    }

    public RecommendationEngine(RecommendationConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config engine settings; validated here
     * @param clock  reference clock for maintenance-overdue checks
     * @throws IllegalStateException if the settings are invalid
     */
    public RecommendationEngine(RecommendationConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "RecommendationConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        config.validate();
    }

    /**
     * @param patterns detected patterns; must not be {@code null}
     * @param context  equipment context; must not be {@code null}
     * @return one entry per pattern, in input order; a pattern without viable
     *         actions gets an empty list
     */
    public List<PatternWithRecommendations> generateRecommendations(List<DetectedPattern> patterns,
            EquipmentContext context) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        Objects.requireNonNull(context, "context must not be null");

        List<PatternWithRecommendations> results = new ArrayList<>(patterns.size());
        int total = 0;
        for (DetectedPattern pattern : patterns) {
            List<Recommendation> recommendations = recommend(
                    Objects.requireNonNull(pattern, "pattern must not be null"), context);
            total += recommendations.size();
            results.add(new PatternWithRecommendations(pattern, recommendations));
        }
        LOG.info("Generated {} recommendation(s) for {} pattern(s)", total, patterns.size());
        return results;
    }

    // ---------------------------------------------------------------
    // Per pattern
    // ---------------------------------------------------------------

    private List<Recommendation> recommend(DetectedPattern pattern, EquipmentContext context) {
        BudgetPolicy policy = config.budgetPolicy();
        Optional<Double> budget = context.getBudgetConstraint();
        List<Recommendation> recommendations = new ArrayList<>();

        for (MaintenanceAction action : ActionCatalog.actionsFor(pattern.getEquipmentType(), pattern.getSeverity())) {
            double success = successProbability(action, pattern, context);
            if (success < config.getMinimumSuccessProbability()) {
                LOG.debug("Dropping {} for {}: success probability {} below minimum",
                        action.getId(), pattern.getPatternId(), success);
                continue;
            }
            double cost = estimatedCost(action, pattern, context);
            boolean withinBudget = budget.map(limit -> cost <= limit).orElse(true);
            if (!withinBudget && policy == BudgetPolicy.FILTER) {
                LOG.debug("Dropping {} for {}: cost {} exceeds budget {}",
                        action.getId(), pattern.getPatternId(), cost, budget.get());
                continue;
            }
            double savings = estimatedSavings(action, pattern, context);
            double roi = (savings - cost) / cost;

            recommendations.add(Recommendation.builder()
                    .actionId(action.getId())
                    .patternId(pattern.getPatternId())
                    .actionType(action.getActionType())
                    .priority(priority(action, pattern, context, roi))
                    .estimatedCost(cost)
                    .estimatedSavings(savings)
                    .timeToImplementHours(implementationHours(action, pattern))
                    .successProbability(success)
                    .requiredExpertise(action.getRequiredExpertise())
                    .withinBudget(withinBudget)
                    .description(describe(action, pattern, context, withinBudget))
                    .build());
        }

        recommendations.sort(ORDER);
        if (recommendations.size() > config.getMaxRecommendationsPerPattern()) {
            return recommendations.subList(0, config.getMaxRecommendationsPerPattern());
        }
        return recommendations;
    }

    double estimatedCost(MaintenanceAction action, DetectedPattern pattern, EquipmentContext context) {
        double cost = action.getBaseCost() * action.getComplexity()
                + action.getRequiredExpertise().getHourlyRate() * action.getBaseHours();
        cost *= CostModel.severityCostMultiplier(pattern.getSeverity());
        cost *= CostModel.equipmentCostMultiplier(pattern.getEquipmentType());
        cost *= 1.0 + Math.min(context.getEquipmentAgeMonths(), 240) / 240.0;
        if (context.getOperationalCriticality() == OperationalCriticality.HIGH) {
            cost *= 1.2;
        }
        if (isMaintenanceOverdue(context)) {
            cost *= 1.1;
        }
        if (isHighFloor(pattern.getFloorNumber(), context)) {
            cost += HIGH_FLOOR_SURCHARGE;
        }
        return Math.max(1.0, Math.round(cost));
    }

    double estimatedSavings(MaintenanceAction action, DetectedPattern pattern, EquipmentContext context) {
        double confidence = pattern.getConfidenceScore() / 100.0;
        double downtime = CostModel.downtimeCostPerHour(pattern.getEquipmentType())
                * CostModel.avoidedDowntimeHours(pattern.getSeverity())
                * action.getPreventionFactor()
                * confidence
                * context.getOperationalCriticality().getSavingsWeight()
                * (1.0 + 0.1 * Math.min(context.getFailureHistory(), 10))
                * operationalHoursFactor(context);
        double avoidedFailure = CostModel.failureCostMultiplier(pattern.getEquipmentType())
                * 1000.0 * confidence * action.getPreventionFactor();
        return Math.max(1.0, Math.round(downtime + avoidedFailure));
    }

    double successProbability(MaintenanceAction action, DetectedPattern pattern, EquipmentContext context) {
        double probability = action.getEffectiveness()
                * (0.5 + pattern.getConfidenceScore() / 200.0)
                * (1.0 - Math.min(0.3, context.getEquipmentAgeMonths() / 480.0))
                * (1.0 - Math.min(0.25, 0.05 * context.getFailureHistory()))
                * CostModel.reliabilityFactor(pattern.getEquipmentType());
        return Statistics.round1(Statistics.clamp(probability, 0.0, MAX_SUCCESS_PROBABILITY));
    }

    static double implementationHours(MaintenanceAction action, DetectedPattern pattern) {
        double hours = action.getBaseHours();
        if (pattern.getConfidenceScore() < 70) {
            hours *= 1.3;
        }
        if (pattern.getFloorNumber() != null && pattern.getFloorNumber() >= 5) {
            hours += 0.5;
        }
        if (action.getRequiredExpertise() == ExpertiseLevel.SPECIALIST) {
            hours += 2.0;
        }
        return Math.max(0.1, Statistics.round1(hours));
    }

    static RecommendationPriority priority(MaintenanceAction action, DetectedPattern pattern,
            EquipmentContext context, double roi) {
        boolean critical = pattern.getSeverity() == Severity.CRITICAL;
        if (critical && (roi >= 1.0 || context.getOperationalCriticality() == OperationalCriticality.HIGH)) {
            return RecommendationPriority.HIGH;
        }
        double score = CostModel.severityPriorityPoints(pattern.getSeverity())
                + pattern.getConfidenceScore() * 0.3
                + action.getUrgencyMultiplier() * 20
                + CostModel.criticalityPriorityPoints(context.getOperationalCriticality());
        if (roi >= 3.0) {
            score += 10;
        } else if (roi >= 1.0) {
            score += 5;
        }
        if (score >= 70) {
            return RecommendationPriority.HIGH;
        }
        return score >= 40 ? RecommendationPriority.MEDIUM : RecommendationPriority.LOW;
    }

    // ---------------------------------------------------------------
    // Context helpers
    // ---------------------------------------------------------------

    boolean isMaintenanceOverdue(EquipmentContext context) {
        return context.getLastMaintenanceDate()
                .map(last -> ChronoUnit.MONTHS.between(last, LocalDate.now(clock))
                        > config.getMaintenanceIntervalMonths())
                .orElse(false);
    }

    /**
     * A floor is high at or above the configured threshold, or on the top two
     * floors of a building with more than two floors.
     */
    boolean isHighFloor(Integer floor, EquipmentContext context) {
        if (floor == null) {
            return false;
        }
        if (floor >= config.getHighFloorThreshold()) {
            return true;
        }
        return context.getBuildingProfile()
                .map(profile -> profile.getFloors() > 2 && floor >= profile.getFloors() - 1)
                .orElse(false);
    }

    private static double operationalHoursFactor(EquipmentContext context) {
        return context.getBuildingProfile()
                .map(BuildingProfile::getOperationalHoursPerDay)
                .map(hours -> Statistics.clamp(hours / 12.0, 0.5, 2.0))
                .orElse(1.0);
    }

    private static String describe(MaintenanceAction action, DetectedPattern pattern, EquipmentContext context,
            boolean withinBudget) {
        StringBuilder description = new StringBuilder(
                action.describe(pattern.getEquipmentType(), pattern.getFloorNumber())).append('.');
        if (pattern.getConfidenceScore() >= 90) {
            description.append(" High-confidence detection, attend promptly.");
        }
        if (context.getOperationalCriticality() == OperationalCriticality.HIGH) {
            description.append(" Critical operational equipment requires priority handling.");
        }
        if (!withinBudget) {
            description.append(String.format(Locale.ROOT, " Exceeds the available budget of %.0f.",
                    context.getBudgetConstraint().orElse(0.0)));
        }
        return description.toString();
    }
}
