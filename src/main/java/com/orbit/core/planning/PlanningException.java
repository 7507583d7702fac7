package com.orbit.core.planning;

/**
 * Thrown to the direct caller of a planning operation: unknown plan or step,
 * unsupported capability, or no goals to plan for.
 */
public class PlanningException extends RuntimeException {
    public PlanningException(String message) {
        super(message);
    }
}
