package com.orbit.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent cycles and planning.
 */
@Service
public class OrbitMetrics {

    private final MeterRegistry registry;

    public OrbitMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCycle(String agent, long ms) {
        Timer.builder("orbit.cycle.duration")
                .tag("agent", agent)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCycleError(String agent) {
        Counter.builder("orbit.cycle.errors")
                .tag("agent", agent)
                .register(registry)
                .increment();
    }

    /**
     * Records a cycle skipped because a guardrail was exceeded.
     *
     * @param reason "memory" or "concurrency"
     */
    public void recordGuardrailPause(String agent, String reason) {
        Counter.builder("orbit.guardrail.pauses")
                .description("Cycles paused by a guardrail")
                .tag("agent", agent)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPlanCreated(String agent, String goalType, double feasibility) {
        Counter.builder("orbit.plans.created")
                .tag("agent", agent)
                .tag("goalType", goalType)
                .register(registry)
                .increment();

        DistributionSummary.builder("orbit.plan.feasibility")
                .tag("agent", agent)
                .register(registry)
                .record(feasibility);
    }

    public void recordGoalCompleted(String agent) {
        Counter.builder("orbit.goals.completed")
                .tag("agent", agent)
                .register(registry)
                .increment();
    }
}
