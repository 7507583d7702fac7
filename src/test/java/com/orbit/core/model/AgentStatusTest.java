package com.orbit.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class AgentStatusTest {

    @Test
    @DisplayName("cycle transitions idle -> thinking -> acting -> idle are allowed")
    void cycleTransitions() {
        assertTrue(AgentStatus.IDLE.canTransitionTo(AgentStatus.THINKING));
        assertTrue(AgentStatus.THINKING.canTransitionTo(AgentStatus.ACTING));
        assertTrue(AgentStatus.ACTING.canTransitionTo(AgentStatus.IDLE));
        assertTrue(AgentStatus.THINKING.canTransitionTo(AgentStatus.IDLE));
        assertTrue(AgentStatus.ERROR.canTransitionTo(AgentStatus.IDLE));
        assertTrue(AgentStatus.STOPPED.canTransitionTo(AgentStatus.IDLE));
    }

    @Test
    @DisplayName("skipping phases is rejected")
    void invalidTransitions() {
        assertFalse(AgentStatus.IDLE.canTransitionTo(AgentStatus.ACTING));
        assertFalse(AgentStatus.ACTING.canTransitionTo(AgentStatus.THINKING));
        assertFalse(AgentStatus.STOPPED.canTransitionTo(AgentStatus.THINKING));
        assertFalse(AgentStatus.ERROR.canTransitionTo(AgentStatus.ACTING));
    }

    @ParameterizedTest
    @EnumSource(AgentStatus.class)
    @DisplayName("error and stopped are reachable from every status")
    void errorAndStoppedAlwaysReachable(AgentStatus from) {
        assertTrue(from.canTransitionTo(AgentStatus.ERROR));
        assertTrue(from.canTransitionTo(AgentStatus.STOPPED));
        assertTrue(from.canTransitionTo(from));
    }

    @Test
    @DisplayName("plan status terminality")
    void planStatusTerminal() {
        assertTrue(PlanStatus.COMPLETED.isTerminal());
        assertTrue(PlanStatus.FAILED.isTerminal());
        assertFalse(PlanStatus.DRAFT.isTerminal());
        assertFalse(PlanStatus.EXECUTING.isTerminal());
    }
}
