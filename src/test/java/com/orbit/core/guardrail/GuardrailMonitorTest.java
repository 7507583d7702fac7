package com.orbit.core.guardrail;

import com.orbit.core.config.AgentProperties;
import com.orbit.core.model.Goal;
import com.orbit.core.model.GoalStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GuardrailMonitorTest {

    private AgentProperties.Guardrails guardrails;
    private double heapMb;
    private GuardrailMonitor monitor;

    @BeforeEach
    void setUp() {
        guardrails = new AgentProperties.Guardrails();
        guardrails.setMaxMemoryUsage(100);
        guardrails.setMaxConcurrentOperations(1);
        heapMb = 50;
        monitor = new GuardrailMonitor(guardrails, () -> heapMb);
    }

    private Goal goal(GoalStatus status) {
        return Goal.immediate("g", 1, Instant.EPOCH).withStatus(status);
    }

    @Test
    @DisplayName("passes within limits")
    void passes() {
        var check = monitor.check(List.of(goal(GoalStatus.IN_PROGRESS), goal(GoalStatus.PENDING)));
        assertTrue(check.passed());
        assertNull(check.reason());
    }

    @Test
    @DisplayName("fails when heap usage exceeds the ceiling")
    void memoryCeiling() {
        heapMb = 150;
        var check = monitor.check(List.of());
        assertFalse(check.passed());
        assertEquals(GuardrailCheck.MEMORY, check.reason());
    }

    @Test
    @DisplayName("fails when too many goals are in progress")
    void concurrencyCeiling() {
        var check = monitor.check(List.of(goal(GoalStatus.IN_PROGRESS), goal(GoalStatus.IN_PROGRESS)));
        assertFalse(check.passed());
        assertEquals(GuardrailCheck.CONCURRENCY, check.reason());
    }

    @Test
    @DisplayName("completed and pending goals do not count towards concurrency")
    void onlyInProgressCounts() {
        var check = monitor.check(List.of(goal(GoalStatus.COMPLETED), goal(GoalStatus.PENDING),
                goal(GoalStatus.FAILED), goal(GoalStatus.IN_PROGRESS)));
        assertTrue(check.passed());
    }
}
