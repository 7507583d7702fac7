package com.orbit.core.agent;

import com.orbit.core.events.EventBus;
import com.orbit.core.guardrail.HeapUsageProbe;
import com.orbit.core.memory.MemoryStore;
import com.orbit.core.metrics.OrbitMetrics;
import com.orbit.core.time.Sleeper;

import java.time.Clock;

/**
 * Shared collaborators an agent is constructed with.
 *
 * @param eventBus       channel for agent events
 * @param memoryStore    episodic memory
 * @param metrics        Micrometer meters
 * @param clock          time source for timestamps, budgets and deadlines
 * @param sleeper        pacing and backoff
 * @param heapUsageProbe memory guardrail input
 */
public record AgentEnvironment(
    EventBus eventBus,
    MemoryStore memoryStore,
    OrbitMetrics metrics,
    Clock clock,
    Sleeper sleeper,
    HeapUsageProbe heapUsageProbe
) {}
