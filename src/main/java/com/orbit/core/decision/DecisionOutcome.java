package com.orbit.core.decision;

import com.orbit.core.model.DecisionOption;

/**
 * What actually happened after a decision was acted on.
 */
public record DecisionOutcome(
    String decisionId,
    DecisionOption selectedOption,
    double actualBenefit,
    long actualDuration,
    boolean success
) {}
