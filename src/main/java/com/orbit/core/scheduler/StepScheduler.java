package com.orbit.core.scheduler;

import com.orbit.core.model.ExecutionPlan;
import com.orbit.core.model.PlanStep;
import com.orbit.core.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes which pending steps of a plan are eligible to run, based on
 * prerequisite satisfaction.
 */
public class StepScheduler {

    private static final Logger log = LoggerFactory.getLogger(StepScheduler.class);

    /**
     * Pending steps whose prerequisites have all completed, in plan order.
     *
     * @param plan  the plan to inspect
     * @param limit maximum number of steps to return
     */
    public List<PlanStep> readySteps(ExecutionPlan plan, int limit) {
        Set<String> completedIds = plan.steps().stream()
                .filter(s -> s.status() == StepStatus.COMPLETED)
                .map(PlanStep::id)
                .collect(Collectors.toSet());

        var ready = new ArrayList<PlanStep>();
        for (var step : plan.steps()) {
            if (ready.size() >= limit) break;
            if (step.status() != StepStatus.PENDING) {
                continue;
            }
            if (!completedIds.containsAll(step.prerequisites())) {
                log.debug("  {} - prerequisites unsatisfied: {}", step.id(), step.prerequisites());
                continue;
            }
            ready.add(step);
        }
        log.debug("Plan {}: {} of {} steps ready", plan.id(), ready.size(), plan.steps().size());
        return ready;
    }

    public Optional<PlanStep> nextReadyStep(ExecutionPlan plan) {
        return readySteps(plan, 1).stream().findFirst();
    }
}
