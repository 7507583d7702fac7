package com.orbit.core.model;

/**
 * Aggregate status of an execution plan, derived from its steps.
 */
public enum PlanStatus {
    DRAFT,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
