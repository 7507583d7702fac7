package com.orbit.core.decision;

import com.orbit.core.config.AgentProperties;
import com.orbit.core.model.DecisionOption;
import com.orbit.core.model.DecisionResult;
import com.orbit.core.model.ExecutionPlan;
import com.orbit.core.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Default {@link DecisionEngine}: scores options by weighted benefit, inverted risk,
 * feasibility and speed, adjusted by how similar past decisions turned out.
 * <p>
 * For a plan, the choice is between executing it and a no-action option; when
 * no-action wins the result carries no selection.
 */
public class WeightedDecisionEngine implements DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(WeightedDecisionEngine.class);

    public static final String NO_ACTION_ID = "no-action";

    static final double PLAN_BENEFIT = 0.7;
    static final double SIMILARITY_THRESHOLD = 0.7;
    static final int MAX_ALTERNATIVES = 3;
    static final int MAX_HISTORY = 1000;

    private final AgentProperties.Decision capabilities;
    private final Clock clock;

    private final Map<String, Recorded> history = new LinkedHashMap<>();

    private record Recorded(DecisionOption option, double confidence, DecisionOutcome outcome) {}

    private record Evaluation(DecisionOption option, double score, double confidence, String reasoning) {}

    public WeightedDecisionEngine(AgentProperties.Decision capabilities, Clock clock) {
        this.capabilities = capabilities;
        this.clock = clock;
        log.info("Decision engine initialized: autonomous={}, maxComplexity={}",
                capabilities.isCanMakeAutonomousDecisions(), capabilities.getMaxDecisionComplexity());
    }

    @Override
    public DecisionResult decide(ExecutionPlan plan) {
        if (capabilities.isRequiresApproval()) {
            return DecisionResult.none("Approval required before executing plan " + plan.id(), clock.instant());
        }

        var planOption = new DecisionOption(
                plan.id(),
                "Execute plan for: " + plan.goal().description(),
                PLAN_BENEFIT,
                assessPlanRisk(plan),
                assessPlanFeasibility(plan),
                plan.estimatedTotalDuration());
        var noAction = new DecisionOption(NO_ACTION_ID, "Do not execute plan", 0.0, 0.0, 1.0, 0L);

        DecisionResult result = makeDecision(
                new DecisionContext(List.of(planOption, noAction), DecisionContext.Constraints.NONE, resolvedOutcomes()),
                DecisionCriteria.DEFAULT);

        if (NO_ACTION_ID.equals(result.selectedOption().id())) {
            log.debug("No-action preferred over plan {}", plan.id());
            return result.withoutSelection();
        }
        return result;
    }

    /**
     * Choose the best option in the context.
     *
     * @throws DecisionException when autonomous decisions are disabled without a confidence
     *                           threshold, when no option survives the filters, or when the
     *                           best option's confidence is below the threshold
     */
    public DecisionResult makeDecision(DecisionContext context, DecisionCriteria criteria) {
        log.debug("Making decision: {} options", context.availableOptions().size());
        DecisionContext.Constraints constraints = context.constraints();

        if (!capabilities.isCanMakeAutonomousDecisions() && constraints.minConfidence() == null) {
            throw new DecisionException("Autonomous decisions not allowed without confidence threshold");
        }

        List<DecisionOption> viable = filterOptions(context.availableOptions(), constraints);
        if (viable.isEmpty()) {
            throw new DecisionException("No viable options after applying constraints");
        }

        List<Evaluation> evaluations = viable.stream()
                .map(o -> evaluateOption(o, context, criteria))
                .toList();

        Evaluation best = evaluations.get(0);
        for (Evaluation e : evaluations) {
            if (e.score() > best.score()) {
                best = e;
            }
        }

        if (constraints.minConfidence() != null && best.confidence() < constraints.minConfidence()) {
            throw new DecisionException(String.format("Confidence %.2f below minimum %.2f",
                    best.confidence(), constraints.minConfidence()));
        }

        String bestId = best.option().id();
        List<DecisionOption> alternatives = evaluations.stream()
                .filter(e -> !e.option().id().equals(bestId))
                .sorted(Comparator.comparingDouble(Evaluation::score).reversed())
                .limit(MAX_ALTERNATIVES)
                .map(Evaluation::option)
                .toList();

        String decisionId = UUID.randomUUID().toString();
        synchronized (history) {
            history.put(decisionId, new Recorded(best.option(), best.confidence(), null));
            if (history.size() > MAX_HISTORY) {
                history.remove(history.keySet().iterator().next());
            }
        }

        log.info("Decision made: option={}, confidence={}", bestId, String.format("%.2f", best.confidence()));
        return new DecisionResult(decisionId, best.option(), best.confidence(), best.reasoning(),
                alternatives, clock.instant());
    }

    /**
     * Report what actually happened for a recorded decision.
     */
    public void updateOutcome(String decisionId, double actualBenefit, long actualDuration, boolean success) {
        DecisionOutcome outcome;
        synchronized (history) {
            Recorded recorded = history.get(decisionId);
            if (recorded == null) {
                log.warn("Decision {} not found in history", decisionId);
                return;
            }
            outcome = new DecisionOutcome(decisionId, recorded.option(), actualBenefit, actualDuration, success);
            history.put(decisionId, new Recorded(recorded.option(), recorded.confidence(), outcome));
        }

        if (capabilities.isCanEvaluateRisk()) {
            double riskError = (success ? 0.0 : 1.0) - outcome.selectedOption().risk();
            if (Math.abs(riskError) > 0.3) {
                log.info("Significant risk assessment error for decision {}: expected {}, error {}",
                        decisionId, outcome.selectedOption().risk(), String.format("%.2f", riskError));
            }
        }
        log.debug("Decision {} outcome recorded: success={}", decisionId, success);
    }

    public DecisionStats getStats() {
        List<Recorded> all;
        synchronized (history) {
            all = new ArrayList<>(history.values());
        }
        List<DecisionOutcome> resolved = all.stream()
                .map(Recorded::outcome)
                .filter(Objects::nonNull)
                .toList();

        double successRate = resolved.isEmpty() ? 0.0
                : resolved.stream().filter(DecisionOutcome::success).count() / (double) resolved.size();
        double averageConfidence = all.stream().mapToDouble(Recorded::confidence).average().orElse(0.0);
        double riskAccuracy = resolved.isEmpty() ? 0.0
                : 1.0 - resolved.stream()
                        .mapToDouble(o -> Math.abs((o.success() ? 0.0 : 1.0) - o.selectedOption().risk()))
                        .average()
                        .orElse(0.0);

        return new DecisionStats(all.size(), successRate, averageConfidence, riskAccuracy);
    }

    List<DecisionOutcome> resolvedOutcomes() {
        synchronized (history) {
            return history.values().stream()
                    .map(Recorded::outcome)
                    .filter(Objects::nonNull)
                    .toList();
        }
    }

    private List<DecisionOption> filterOptions(List<DecisionOption> options, DecisionContext.Constraints constraints) {
        return options.stream()
                .filter(o -> constraints.maxRisk() == null || o.risk() <= constraints.maxRisk())
                .filter(o -> constraints.timeLimit() == null
                        || o.estimatedDuration() <= 0
                        || o.estimatedDuration() <= constraints.timeLimit())
                .toList();
    }

    private Evaluation evaluateOption(DecisionOption option, DecisionContext context, DecisionCriteria criteria) {
        double score = 0.0;
        var reasons = new ArrayList<String>();

        score += option.expectedBenefit() * criteria.benefitWeight();
        reasons.add(String.format("Benefit: %.0f%%", option.expectedBenefit() * 100));

        score += (1 - option.risk()) * criteria.riskWeight();
        reasons.add(String.format("Risk: %.0f%%", option.risk() * 100));

        score += option.feasibility() * criteria.feasibilityWeight();
        reasons.add(String.format("Feasibility: %.0f%%", option.feasibility() * 100));

        if (option.estimatedDuration() > 0 && criteria.speedWeight() > 0) {
            score += (1 / (1 + option.estimatedDuration() / 60000.0)) * criteria.speedWeight();
            reasons.add("Duration: " + Math.round(option.estimatedDuration() / 1000.0) + "s");
        }

        if (!context.historicalOutcomes().isEmpty()) {
            double adjustment = historicalAdjustment(option, context.historicalOutcomes());
            score *= adjustment;
            if (adjustment != 1.0) {
                reasons.add(String.format("Historical adjustment: %.0f%%", (adjustment - 1) * 100));
            }
        }

        return new Evaluation(option, clamp(score), calculateConfidence(option, context), String.join("; ", reasons));
    }

    private double calculateConfidence(DecisionOption option, DecisionContext context) {
        double confidence = 0.5;

        double complexity = (option.risk() + (1 - option.feasibility())) / 2;
        confidence += (1 - complexity) * 0.3;

        if (!context.historicalOutcomes().isEmpty()) {
            confidence += Math.min(0.2, context.historicalOutcomes().size() * 0.02);
        }
        if (capabilities.getMaxDecisionComplexity() > 5) {
            confidence += 0.1;
        }
        return clamp(confidence);
    }

    private double historicalAdjustment(DecisionOption option, List<DecisionOutcome> outcomes) {
        List<DecisionOutcome> similar = outcomes.stream()
                .filter(o -> similarity(option, o.selectedOption()) > SIMILARITY_THRESHOLD)
                .toList();
        if (similar.isEmpty()) {
            return 1.0;
        }

        double successRate = similar.stream().filter(DecisionOutcome::success).count() / (double) similar.size();
        if (successRate > 0.8) {
            return 1.2;
        } else if (successRate < 0.3) {
            return 0.8;
        }
        return 1.0;
    }

    private static double similarity(DecisionOption a, DecisionOption b) {
        double avgDiff = (Math.abs(a.expectedBenefit() - b.expectedBenefit())
                + Math.abs(a.risk() - b.risk())
                + Math.abs(a.feasibility() - b.feasibility())) / 3;
        return 1 - avgDiff;
    }

    /**
     * More steps, failed steps and longer plans are riskier.
     */
    static double assessPlanRisk(ExecutionPlan plan) {
        double risk = Math.min(0.3, plan.steps().size() * 0.05);
        risk += plan.countSteps(StepStatus.FAILED) * 0.1;
        if (plan.estimatedTotalDuration() > 0) {
            risk += Math.min(0.2, plan.estimatedTotalDuration() / (60.0 * 60 * 1000));
        }
        return Math.min(1.0, risk);
    }

    static double assessPlanFeasibility(ExecutionPlan plan) {
        double feasibility = 1.0 - plan.countSteps(StepStatus.PENDING) * 0.1;
        if (!plan.steps().isEmpty()) {
            feasibility = Math.max(feasibility, plan.countSteps(StepStatus.COMPLETED) / (double) plan.steps().size());
        }
        return Math.max(0.0, feasibility);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
