package com.orbit.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A single step of an execution plan.
 *
 * @param id                unique identifier
 * @param action            action text; may contain "use &lt;resource&gt;" phrases
 * @param description       human-readable description
 * @param prerequisites     IDs of earlier steps in the same plan that must complete first
 * @param estimatedDuration estimated duration in milliseconds
 * @param status            current status
 * @param requiredResources resources this step needs, when known structurally
 */
public record PlanStep(
    String id,
    String action,
    String description,
    List<String> prerequisites,
    long estimatedDuration,
    StepStatus status,
    List<String> requiredResources
) implements Serializable {

    public PlanStep {
        prerequisites = prerequisites == null ? List.of() : List.copyOf(prerequisites);
        requiredResources = requiredResources == null ? List.of() : List.copyOf(requiredResources);
    }

    public PlanStep withStatus(StepStatus newStatus) {
        return new PlanStep(id, action, description, prerequisites, estimatedDuration, newStatus, requiredResources);
    }

    public PlanStep withPrerequisites(List<String> newPrerequisites) {
        return new PlanStep(id, action, description, newPrerequisites, estimatedDuration, status, requiredResources);
    }

    public boolean hasPrerequisites() {
        return !prerequisites.isEmpty();
    }
}
