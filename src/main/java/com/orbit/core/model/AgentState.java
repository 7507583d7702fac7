package com.orbit.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of an agent's state.
 */
public record AgentState(
    String id,
    String name,
    String specialty,
    AgentStatus status,
    List<Goal> currentGoals,
    AgentContext currentContext,
    Instant lastActivity,
    int errorCount
) implements Serializable {

    public AgentState {
        currentGoals = currentGoals == null ? List.of() : List.copyOf(currentGoals);
    }

    public long countGoals(GoalStatus goalStatus) {
        return currentGoals.stream().filter(g -> g.status() == goalStatus).count();
    }
}
