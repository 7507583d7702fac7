package com.orbit.core.decision;

/**
 * Thrown when no option can be selected under the given constraints.
 */
public class DecisionException extends RuntimeException {
    public DecisionException(String message) {
        super(message);
    }
}
