package com.orbit.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A validated plan together with its feasibility score and textual risk warnings.
 *
 * @param plan              the plan
 * @param feasibility       heuristic score in [0,1]
 * @param estimatedDuration estimated duration in milliseconds
 * @param risks             risk warnings
 */
public record PlanningResult(
    ExecutionPlan plan,
    double feasibility,
    long estimatedDuration,
    List<String> risks
) implements Serializable {

    public PlanningResult {
        risks = risks == null ? List.of() : List.copyOf(risks);
    }
}
