package com.orbit.core.planning;

import com.orbit.core.config.AgentProperties;
import com.orbit.core.model.ExecutionPlan;
import com.orbit.core.model.Goal;
import com.orbit.core.model.GoalStatus;
import com.orbit.core.model.GoalType;
import com.orbit.core.model.PlanConstraints;
import com.orbit.core.model.PlanStatus;
import com.orbit.core.model.PlanStep;
import com.orbit.core.model.PlanningContext;
import com.orbit.core.model.PlanningResult;
import com.orbit.core.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Default {@link PlanningEngine}: deadline-aware goal prioritization, hint-driven step
 * generation, critical-path duration estimates, multiplicative feasibility scoring
 * and re-planning that preserves completed work.
 * <p>
 * Step generation is synchronous and deterministic apart from step IDs.
 */
public class HierarchicalPlanningEngine implements PlanningEngine {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalPlanningEngine.class);

    static final long IMMEDIATE_STEP_DURATION_MS = 5000;
    static final long COMPLEX_STEP_DURATION_MS = 10000;
    static final int DEFAULT_COMPLEX_STEPS = 3;
    static final int MIN_RESOURCES = 3;

    static final String RISK_DEADLINE = "Plan may not complete before deadline";
    static final String RISK_DEPENDENCIES = "Plan has dependencies that could cause delays";
    static final String RISK_RESOURCES = "Limited resources available";

    private final AgentProperties.Planning capabilities;
    private final Clock clock;
    private final PlanStore store = new PlanStore();

    public HierarchicalPlanningEngine(AgentProperties.Planning capabilities, Clock clock) {
        this.capabilities = capabilities;
        this.clock = clock;
        log.info("Planning engine initialized: maxHorizon={}, supportedTypes={}",
                capabilities.getMaxPlanningHorizon(), capabilities.getSupportedPlanTypes());
    }

    @Override
    public PlanningResult createPlan(PlanningContext context, List<String> hints) {
        if (!capabilities.isCanCreatePlans()) {
            throw new PlanningException("Plan creation not supported");
        }
        log.debug("Creating plan: {} goals, {} hints", context.currentGoals().size(), hints.size());

        List<Goal> ordered = capabilities.isCanPrioritizeTasks()
                ? prioritizeGoals(context.currentGoals())
                : context.currentGoals();
        if (ordered.isEmpty()) {
            throw new PlanningException("No goals to plan for");
        }
        Goal target = ordered.get(0);

        List<PlanStep> steps = generateSteps(target, hints, context, 0);
        var plan = new ExecutionPlan(
                UUID.randomUUID().toString(),
                target,
                steps,
                estimateDuration(steps),
                PlanStatus.DRAFT,
                clock.instant());

        store.put(plan);
        return assess(plan, context);
    }

    @Override
    public PlanningResult adaptPlan(String planId, PlanningContext newContext) {
        if (!capabilities.isCanAdaptPlans()) {
            throw new PlanningException("Plan adaptation not supported");
        }
        ExecutionPlan existing = requirePlan(planId);
        log.info("Adapting plan {}", planId);

        List<PlanStep> completed = existing.steps().stream()
                .filter(s -> s.status() == StepStatus.COMPLETED)
                .toList();
        List<PlanStep> regenerated = generateSteps(existing.goal(), List.of(), newContext, completed.size());

        var steps = new ArrayList<PlanStep>(completed.size() + regenerated.size());
        steps.addAll(completed);
        steps.addAll(regenerated);

        var adapted = new ExecutionPlan(
                existing.id(),
                existing.goal(),
                steps,
                estimateDuration(steps),
                statusAfterAdaptation(steps),
                existing.createdAt());

        store.put(adapted);
        return assess(adapted, newContext);
    }

    @Override
    public ExecutionPlan updatePlanProgress(String planId, String stepId, StepStatus status) {
        ExecutionPlan plan = requirePlan(planId);
        if (plan.steps().stream().noneMatch(s -> s.id().equals(stepId))) {
            throw new PlanningException("Step " + stepId + " not found in plan " + planId);
        }

        ExecutionPlan updated = store.update(planId, current -> {
            List<PlanStep> steps = current.steps().stream()
                    .map(s -> s.id().equals(stepId) ? s.withStatus(status) : s)
                    .toList();
            var next = current.withSteps(steps, current.estimatedTotalDuration());
            return next.withStatus(aggregateStatus(steps, current.status()));
        }).orElseThrow(() -> new PlanningException("Plan " + planId + " not found"));

        log.debug("Plan {} step {} -> {}, plan status {}", planId, stepId, status, updated.status());
        return updated;
    }

    @Override
    public PlanningResult assessPlan(String planId, PlanningContext context) {
        return assess(requirePlan(planId), context);
    }

    @Override
    public Optional<ExecutionPlan> getPlan(String planId) {
        return store.get(planId);
    }

    @Override
    public Optional<ExecutionPlan> findActivePlan(String goalId) {
        return store.all().stream()
                .filter(p -> p.goal().id().equals(goalId))
                .filter(p -> !p.status().isTerminal())
                .findFirst();
    }

    @Override
    public List<ExecutionPlan> getActivePlans() {
        return store.all();
    }

    @Override
    public int cleanup() {
        int removed = store.removeIf(p -> p.status().isTerminal());
        log.debug("Cleaned up {} plans", removed);
        return removed;
    }

    /**
     * Stable sort, highest composite score first.
     * Score = priority + urgency + 1 if already in progress, where urgency is
     * {@code 2 / msUntilDeadline}; an overdue or due-now goal scores infinitely urgent.
     */
    public List<Goal> prioritizeGoals(List<Goal> goals) {
        Instant now = clock.instant();
        record Scored(Goal goal, double score) {}

        return goals.stream()
                .map(g -> new Scored(g, score(g, now)))
                .sorted(Comparator.comparingDouble(Scored::score).reversed())
                .map(Scored::goal)
                .collect(Collectors.toList());
    }

    double score(Goal goal, Instant now) {
        double score = goal.priority();
        if (goal.hasDeadline()) {
            double msUntilDeadline = Duration.between(now, goal.deadline()).toNanos() / 1_000_000.0;
            score += msUntilDeadline <= 0 ? Double.POSITIVE_INFINITY : 2.0 / msUntilDeadline;
        }
        if (goal.status() == GoalStatus.IN_PROGRESS) {
            score += 1;
        }
        return score;
    }

    List<PlanStep> generateSteps(Goal goal, List<String> hints, PlanningContext context, int startIndex) {
        var steps = new ArrayList<PlanStep>();
        int horizon = capabilities.getMaxPlanningHorizon();
        PlanConstraints constraints = context.constraints();
        int maxSteps = Math.min(constraints.hasMaxSteps() ? constraints.maxSteps() : horizon, horizon);

        if (goal.type() == GoalType.IMMEDIATE) {
            // one step per immediate goal; nothing left to regenerate once it exists
            if (startIndex == 0) {
                steps.add(new PlanStep(
                        UUID.randomUUID().toString(),
                        "Execute: " + goal.description(),
                        goal.description(),
                        List.of(),
                        IMMEDIATE_STEP_DURATION_MS,
                        StepStatus.PENDING,
                        List.of()));
            }
        } else {
            String keyword = firstWord(goal.description());
            List<String> relevant = hints.stream()
                    .filter(h -> h.toLowerCase(Locale.ROOT).contains(keyword))
                    .toList();

            int wanted = relevant.isEmpty() ? DEFAULT_COMPLEX_STEPS : relevant.size();
            int stepCount = Math.max(0, Math.min(wanted, maxSteps - startIndex));

            for (int i = 0; i < stepCount; i++) {
                String hint = i < relevant.size() ? relevant.get(i) : null;
                steps.add(new PlanStep(
                        UUID.randomUUID().toString(),
                        hint != null ? hint : "Step " + (startIndex + i + 1) + ": " + goal.description(),
                        hint != null ? hint : "Execute part " + (i + 1) + " of " + goal.description(),
                        List.of(),
                        COMPLEX_STEP_DURATION_MS * (i + 1),
                        StepStatus.PENDING,
                        hint != null ? ResourceExtractor.extract(hint) : List.of()));
            }
        }

        if (capabilities.isSequentialOnly()) {
            for (int i = 1; i < steps.size(); i++) {
                steps.set(i, steps.get(i).withPrerequisites(List.of(steps.get(i - 1).id())));
            }
        }
        return steps;
    }

    /**
     * Sequential plans sum step durations. Parallel-capable plans take the longest
     * single step, which understates the critical path when independent chains exist.
     */
    long estimateDuration(List<PlanStep> steps) {
        if (capabilities.supportsParallel()) {
            return steps.stream().mapToLong(PlanStep::estimatedDuration).max().orElse(0L);
        }
        return steps.stream().mapToLong(PlanStep::estimatedDuration).sum();
    }

    double validatePlan(ExecutionPlan plan, PlanningContext context) {
        double feasibility = 1.0;
        PlanConstraints constraints = context.constraints();

        if (constraints.hasMaxSteps() && plan.steps().size() > constraints.maxSteps()) {
            feasibility *= 0.7;
        }
        if (constraints.hasMaxDuration() && plan.estimatedTotalDuration() > constraints.maxDuration()) {
            feasibility *= 0.8;
        }

        Set<String> available = context.availableResources().stream()
                .map(r -> r.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        boolean missing = plan.steps().stream()
                .flatMap(s -> ResourceExtractor.requiredResources(s).stream())
                .anyMatch(r -> !available.contains(r));
        if (missing) {
            feasibility *= 0.5;
        }

        return Math.max(0.0, Math.min(1.0, feasibility));
    }

    List<String> identifyRisks(ExecutionPlan plan, PlanningContext context) {
        var risks = new ArrayList<String>();

        Goal goal = plan.goal();
        if (goal.hasDeadline() && plan.estimatedTotalDuration() > 0) {
            long timeLeft = Duration.between(clock.instant(), goal.deadline()).toMillis();
            if (plan.estimatedTotalDuration() > timeLeft) {
                risks.add(RISK_DEADLINE);
            }
        }
        if (plan.steps().stream().anyMatch(PlanStep::hasPrerequisites)) {
            risks.add(RISK_DEPENDENCIES);
        }
        if (context.availableResources().size() < MIN_RESOURCES) {
            risks.add(RISK_RESOURCES);
        }
        return risks;
    }

    private PlanningResult assess(ExecutionPlan plan, PlanningContext context) {
        return new PlanningResult(
                plan,
                validatePlan(plan, context),
                plan.estimatedTotalDuration(),
                identifyRisks(plan, context));
    }

    private ExecutionPlan requirePlan(String planId) {
        return store.get(planId).orElseThrow(() -> new PlanningException("Plan " + planId + " not found"));
    }

    /**
     * Failed wins over everything; all-completed means completed; any in-progress step
     * means executing; otherwise the status is left as it was.
     */
    static PlanStatus aggregateStatus(List<PlanStep> steps, PlanStatus current) {
        if (steps.stream().anyMatch(s -> s.status() == StepStatus.FAILED)) {
            return PlanStatus.FAILED;
        }
        if (!steps.isEmpty() && steps.stream().allMatch(s -> s.status() == StepStatus.COMPLETED)) {
            return PlanStatus.COMPLETED;
        }
        if (steps.stream().anyMatch(s -> s.status() == StepStatus.IN_PROGRESS)) {
            return PlanStatus.EXECUTING;
        }
        return current;
    }

    private static PlanStatus statusAfterAdaptation(List<PlanStep> steps) {
        boolean anyCompleted = steps.stream().anyMatch(s -> s.status() == StepStatus.COMPLETED);
        if (!anyCompleted) {
            return PlanStatus.DRAFT;
        }
        return steps.stream().allMatch(s -> s.status() == StepStatus.COMPLETED)
                ? PlanStatus.COMPLETED
                : PlanStatus.EXECUTING;
    }

    private static String firstWord(String description) {
        if (description == null) {
            return "";
        }
        return description.toLowerCase(Locale.ROOT).split(" ")[0];
    }
}
