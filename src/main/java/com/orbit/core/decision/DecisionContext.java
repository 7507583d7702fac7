package com.orbit.core.decision;

import com.orbit.core.model.DecisionOption;

import java.util.List;

/**
 * Options to choose between and the limits that apply.
 *
 * @param availableOptions   candidates
 * @param constraints        filters and thresholds
 * @param historicalOutcomes resolved past decisions used to adjust scores
 */
public record DecisionContext(
    List<DecisionOption> availableOptions,
    Constraints constraints,
    List<DecisionOutcome> historicalOutcomes
) {

    public DecisionContext {
        availableOptions = availableOptions == null ? List.of() : List.copyOf(availableOptions);
        constraints = constraints == null ? Constraints.NONE : constraints;
        historicalOutcomes = historicalOutcomes == null ? List.of() : List.copyOf(historicalOutcomes);
    }

    /**
     * @param maxRisk       drop options riskier than this (nullable)
     * @param minConfidence reject a decision less confident than this (nullable)
     * @param timeLimit     drop options estimated to take longer, in ms (nullable)
     */
    public record Constraints(Double maxRisk, Double minConfidence, Long timeLimit) {
        public static final Constraints NONE = new Constraints(null, null, null);
    }
}
