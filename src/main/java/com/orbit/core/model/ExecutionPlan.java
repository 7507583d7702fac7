package com.orbit.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * An ordered, dependency-linked set of steps targeting one goal.
 * Instances are immutable; progress and adaptation produce new plans.
 *
 * @param id                     unique identifier
 * @param goal                   the goal this plan targets
 * @param steps                  ordered steps
 * @param estimatedTotalDuration estimated duration in milliseconds
 * @param status                 aggregate status
 * @param createdAt              creation time
 */
public record ExecutionPlan(
    String id,
    Goal goal,
    List<PlanStep> steps,
    long estimatedTotalDuration,
    PlanStatus status,
    Instant createdAt
) implements Serializable {

    public ExecutionPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public ExecutionPlan withSteps(List<PlanStep> newSteps, long newDuration) {
        return new ExecutionPlan(id, goal, newSteps, newDuration, status, createdAt);
    }

    public ExecutionPlan withStatus(PlanStatus newStatus) {
        return new ExecutionPlan(id, goal, steps, estimatedTotalDuration, newStatus, createdAt);
    }

    public long countSteps(StepStatus stepStatus) {
        return steps.stream().filter(s -> s.status() == stepStatus).count();
    }
}
