package com.orbit.core.model;

/**
 * Status of a single step within an execution plan.
 */
public enum StepStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
