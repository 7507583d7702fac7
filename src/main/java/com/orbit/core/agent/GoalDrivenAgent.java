package com.orbit.core.agent;

import com.orbit.core.config.AgentProperties;
import com.orbit.core.decision.DecisionEngine;
import com.orbit.core.decision.WeightedDecisionEngine;
import com.orbit.core.events.AgentEvents;
import com.orbit.core.logging.MdcContext;
import com.orbit.core.memory.MemoryEntry;
import com.orbit.core.model.AgentContext;
import com.orbit.core.model.AgentMessage;
import com.orbit.core.model.AgentState;
import com.orbit.core.model.DecisionOption;
import com.orbit.core.model.DecisionResult;
import com.orbit.core.model.ExecutionPlan;
import com.orbit.core.model.Goal;
import com.orbit.core.model.GoalStatus;
import com.orbit.core.model.Perception;
import com.orbit.core.model.PlanStep;
import com.orbit.core.model.PlanningContext;
import com.orbit.core.model.PlanningResult;
import com.orbit.core.model.StepStatus;
import com.orbit.core.model.ToolResult;
import com.orbit.core.planning.PlanningEngine;
import com.orbit.core.planning.PlanningException;
import com.orbit.core.scheduler.StepScheduler;
import com.orbit.core.tools.StepExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Agent that works its goals one plan step per cycle.
 * <p>
 * A goal keeps its plan across cycles: the active plan is re-assessed rather than
 * recreated, or adapted when a message brings new hints and adaptation is enabled.
 * When a plan completes its goal is reported and removed; when it fails the goal is dropped.
 */
public class GoalDrivenAgent extends AutonomousAgent {

    private static final Logger log = LoggerFactory.getLogger(GoalDrivenAgent.class);

    static final double STEP_MEMORY_IMPORTANCE = 0.3;
    static final double FAILED_STEP_BENEFIT = 0.0;

    private final StepExecutor stepExecutor;
    private final StepScheduler stepScheduler = new StepScheduler();
    private final List<String> standingHints = new CopyOnWriteArrayList<>();

    // loop thread only
    private DecisionResult lastDecision;
    private ActiveStep activeStep;

    private record ActiveStep(String planId, String stepId, String goalId) {}

    public GoalDrivenAgent(AgentProperties properties, AgentEnvironment environment, StepExecutor stepExecutor) {
        super(properties, environment);
        this.stepExecutor = stepExecutor;
    }

    public GoalDrivenAgent(AgentProperties properties, AgentEnvironment environment,
                           PlanningEngine planningEngine, DecisionEngine decisionEngine, StepExecutor stepExecutor) {
        super(properties, environment, planningEngine, decisionEngine);
        this.stepExecutor = stepExecutor;
    }

    /**
     * Hints offered to the planner on every cycle.
     */
    public void addHints(List<String> hints) {
        standingHints.addAll(hints);
    }

    @Override
    protected Perception perceive() {
        AgentState state = getState();
        Map<String, Object> observations = new HashMap<>();
        observations.put("pendingGoals", state.countGoals(GoalStatus.PENDING));
        observations.put("activeGoals", state.countGoals(GoalStatus.IN_PROGRESS));

        List<String> hints = new ArrayList<>(standingHints);
        Object pending = state.currentContext().environmentState().get(PENDING_MESSAGE_KEY);
        if (pending instanceof AgentMessage message) {
            observations.put("message", message.id());
            if (message.content() instanceof String text) {
                hints.add(text);
            }
            updateAgentContext(ctx -> {
                Map<String, Object> environmentState = new HashMap<>(ctx.environmentState());
                environmentState.remove(PENDING_MESSAGE_KEY);
                return new AgentContext(ctx.currentTask(), environmentState, ctx.collaboratingAgents(),
                        ctx.availableResources(), ctx.timestamp());
            });
        }
        return new Perception(observations, hints);
    }

    /**
     * Continue the first goal that already has an active plan; otherwise plan for the
     * highest-priority goal.
     */
    @Override
    protected Optional<PlanningResult> plan(Perception perception) {
        PlanningContext planningContext = planningContext();
        if (planningContext.currentGoals().isEmpty()) {
            return Optional.empty();
        }

        boolean newInformation = perception.observations().containsKey("message");
        for (Goal goal : planningContext.currentGoals()) {
            Optional<ExecutionPlan> active = planningEngine.findActivePlan(goal.id());
            if (active.isEmpty()) {
                continue;
            }
            String planId = active.get().id();
            if (newInformation && properties.getCapabilities().getPlanning().isCanAdaptPlans()) {
                log.info("Adapting plan {} to new information", planId);
                return Optional.of(planningEngine.adaptPlan(planId, planningContext));
            }
            return Optional.of(planningEngine.assessPlan(planId, planningContext));
        }
        return Optional.of(createPlan(planningContext, perception.hints()));
    }

    @Override
    protected DecisionResult decide(PlanningResult planning) {
        lastDecision = super.decide(planning);
        return lastDecision;
    }

    @Override
    protected ToolResult execute(DecisionOption option) {
        activeStep = null;
        ExecutionPlan plan = planningEngine.getPlan(option.id())
                .orElseThrow(() -> new PlanningException("Selected plan " + option.id() + " not found"));
        MdcContext.setPlan(plan.id());

        Optional<PlanStep> next = stepScheduler.nextReadyStep(plan);
        if (next.isEmpty()) {
            log.debug("Plan {} has no ready step", plan.id());
            return ToolResult.success(null, 0, clock.instant());
        }

        PlanStep step = next.get();
        updateGoalStatus(plan.goal().id(), GoalStatus.IN_PROGRESS);
        planningEngine.updatePlanProgress(plan.id(), step.id(), StepStatus.IN_PROGRESS);
        activeStep = new ActiveStep(plan.id(), step.id(), plan.goal().id());

        log.info("Executing step {}: {}", step.id(), step.action());
        return stepExecutor.execute(plan, step, tools());
    }

    @Override
    protected void learn(ToolResult result) {
        ActiveStep step = activeStep;
        activeStep = null;
        if (step == null) {
            return;
        }

        ExecutionPlan updated = planningEngine.updatePlanProgress(step.planId(), step.stepId(),
                result.success() ? StepStatus.COMPLETED : StepStatus.FAILED);

        Map<String, Object> content = new HashMap<>();
        content.put("action", result.success() ? "step_completed" : "step_failed");
        content.put("planId", step.planId());
        content.put("stepId", step.stepId());
        if (result.error() != null) {
            content.put("error", result.error());
        }
        memoryStore.store(MemoryEntry.episodic(content, STEP_MEMORY_IMPORTANCE));

        if (lastDecision != null && decisionEngine instanceof WeightedDecisionEngine weighted) {
            weighted.updateOutcome(lastDecision.decisionId(),
                    result.success() ? lastDecision.selectedOption().expectedBenefit() : FAILED_STEP_BENEFIT,
                    result.duration(), result.success());
        }

        switch (updated.status()) {
            case COMPLETED -> {
                updateGoalStatus(step.goalId(), GoalStatus.COMPLETED);
                removeGoal(step.goalId());
                emit(AgentEvents.GOAL_COMPLETED, Map.of(
                        "goalId", step.goalId(),
                        "planId", step.planId(),
                        "description", updated.goal().description()));
            }
            case FAILED -> {
                log.warn("Plan {} failed at step {}: {}", step.planId(), step.stepId(), result.error());
                updateGoalStatus(step.goalId(), GoalStatus.FAILED);
                removeGoal(step.goalId());
            }
            default -> log.debug("Plan {} progress: {}/{} steps completed", step.planId(),
                    updated.countSteps(StepStatus.COMPLETED), updated.steps().size());
        }

        int removed = planningEngine.cleanup();
        if (removed > 0) {
            log.debug("Removed {} finished plans", removed);
        }
    }
}
