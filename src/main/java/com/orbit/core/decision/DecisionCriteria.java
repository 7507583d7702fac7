package com.orbit.core.decision;

/**
 * Weights applied when scoring an option.
 */
public record DecisionCriteria(
    double benefitWeight,
    double riskWeight,
    double feasibilityWeight,
    double speedWeight
) {
    public static final DecisionCriteria DEFAULT = new DecisionCriteria(0.4, 0.3, 0.2, 0.1);
}
