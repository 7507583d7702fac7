package com.orbit.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OrbitMetricsTest {

    private SimpleMeterRegistry registry;
    private OrbitMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OrbitMetrics(registry);
    }

    @Test
    @DisplayName("recordCycle creates a timer per agent")
    void recordCycle() {
        metrics.recordCycle("orbit", 120);
        metrics.recordCycle("orbit", 80);

        var timer = registry.find("orbit.cycle.duration").tag("agent", "orbit").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
    }

    @Test
    @DisplayName("recordGuardrailPause tags the reason")
    void recordGuardrailPause() {
        metrics.recordGuardrailPause("orbit", "memory");
        metrics.recordGuardrailPause("orbit", "memory");
        metrics.recordGuardrailPause("orbit", "concurrency");

        assertEquals(2.0, registry.find("orbit.guardrail.pauses").tag("reason", "memory").counter().count());
        assertEquals(1.0, registry.find("orbit.guardrail.pauses").tag("reason", "concurrency").counter().count());
    }

    @Test
    @DisplayName("recordPlanCreated counts plans and records feasibility")
    void recordPlanCreated() {
        metrics.recordPlanCreated("orbit", "COMPLEX", 0.5);

        assertEquals(1.0, registry.find("orbit.plans.created").tag("goalType", "COMPLEX").counter().count());
        var summary = registry.find("orbit.plan.feasibility").summary();
        assertNotNull(summary);
        assertEquals(0.5, summary.totalAmount());
    }

    @Test
    @DisplayName("error and goal counters increment")
    void counters() {
        metrics.recordCycleError("orbit");
        metrics.recordGoalCompleted("orbit");
        metrics.recordGoalCompleted("orbit");

        assertEquals(1.0, registry.find("orbit.cycle.errors").counter().count());
        assertEquals(2.0, registry.find("orbit.goals.completed").counter().count());
    }
}
