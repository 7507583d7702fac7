package com.orbit.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a decision. The cycle loop only acts when an option was selected.
 *
 * @param decisionId     identifier for reporting the actual outcome later
 * @param selectedOption the chosen option, or null when nothing should be executed
 * @param confidence     0-1
 * @param reasoning      human-readable scoring breakdown
 * @param alternatives   runner-up options, best first
 * @param timestamp      when the decision was made
 */
public record DecisionResult(
    String decisionId,
    DecisionOption selectedOption,
    double confidence,
    String reasoning,
    List<DecisionOption> alternatives,
    Instant timestamp
) implements Serializable {

    public DecisionResult {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public static DecisionResult none(String reasoning, Instant timestamp) {
        return new DecisionResult(null, null, 0.0, reasoning, List.of(), timestamp);
    }

    public Optional<DecisionOption> selection() {
        return Optional.ofNullable(selectedOption);
    }

    public DecisionResult withoutSelection() {
        return new DecisionResult(decisionId, null, confidence, reasoning, alternatives, timestamp);
    }
}
