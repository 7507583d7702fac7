package com.orbit.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Input to the planning engine.
 *
 * @param currentGoals       goals to choose from
 * @param availableResources resource names the agent can use
 * @param constraints        plan caps
 */
public record PlanningContext(
    List<Goal> currentGoals,
    List<String> availableResources,
    PlanConstraints constraints
) implements Serializable {

    public PlanningContext {
        currentGoals = currentGoals == null ? List.of() : List.copyOf(currentGoals);
        availableResources = availableResources == null ? List.of() : List.copyOf(availableResources);
        constraints = constraints == null ? PlanConstraints.none() : constraints;
    }
}
