package com.orbit.core.model;

import java.io.Serializable;

/**
 * A candidate action considered by the decision engine.
 *
 * @param id                unique identifier (the plan ID for plan-execution options)
 * @param description       what choosing this option means
 * @param expectedBenefit   0-1
 * @param risk              0-1
 * @param feasibility       0-1
 * @param estimatedDuration milliseconds, 0 when unknown
 */
public record DecisionOption(
    String id,
    String description,
    double expectedBenefit,
    double risk,
    double feasibility,
    long estimatedDuration
) implements Serializable {}
