package com.orbit.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * What the agent currently knows about its environment.
 *
 * @param currentTask         the task being worked on (nullable)
 * @param environmentState    latest perception and pending messages
 * @param collaboratingAgents IDs of agents this one works with
 * @param availableResources  resource names usable by plans
 * @param timestamp           when the context was last refreshed
 */
public record AgentContext(
    String currentTask,
    Map<String, Object> environmentState,
    List<String> collaboratingAgents,
    List<String> availableResources,
    Instant timestamp
) implements Serializable {

    public AgentContext {
        environmentState = environmentState == null ? Map.of() : Map.copyOf(environmentState);
        collaboratingAgents = collaboratingAgents == null ? List.of() : List.copyOf(collaboratingAgents);
        availableResources = availableResources == null ? List.of() : List.copyOf(availableResources);
    }
}
