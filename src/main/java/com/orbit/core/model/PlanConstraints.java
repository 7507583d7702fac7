package com.orbit.core.model;

import java.io.Serializable;

/**
 * Optional caps applied while generating and validating a plan.
 *
 * @param maxSteps    maximum step count, or null for no cap
 * @param maxDuration maximum estimated duration in milliseconds, or null for no cap
 */
public record PlanConstraints(
    Integer maxSteps,
    Long maxDuration
) implements Serializable {

    private static final PlanConstraints NONE = new PlanConstraints(null, null);

    public static PlanConstraints none() {
        return NONE;
    }

    public boolean hasMaxSteps() {
        return maxSteps != null && maxSteps > 0;
    }

    public boolean hasMaxDuration() {
        return maxDuration != null && maxDuration > 0;
    }
}
