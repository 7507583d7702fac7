package com.orbit.core.model;

/**
 * Lifecycle status of an autonomous agent.
 * <p>
 * IDLE is the initial state. STOPPED is terminal until the agent is started again.
 */
public enum AgentStatus {
    IDLE,
    THINKING,
    ACTING,
    ERROR,
    STOPPED;

    /**
     * Whether the cycle loop may move from this status to {@code next}.
     * Re-entering the current status is always allowed.
     */
    public boolean canTransitionTo(AgentStatus next) {
        if (this == next) {
            return true;
        }
        return switch (next) {
            case ERROR, STOPPED -> true;
            case THINKING -> this == IDLE;
            case ACTING -> this == THINKING;
            case IDLE -> this != IDLE;
        };
    }
}
