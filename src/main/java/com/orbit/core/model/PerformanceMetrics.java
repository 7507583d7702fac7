package com.orbit.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Per-agent cycle statistics.
 *
 * @param tasksCompleted      goals completed
 * @param tasksAttempted      cycles attempted
 * @param successRate         tasksCompleted / tasksAttempted, 0 when nothing was attempted
 * @param averageResponseTime running mean of cycle time in milliseconds
 * @param uptime              milliseconds since the agent was created
 * @param lastError           time of the most recent cycle error (nullable)
 */
public record PerformanceMetrics(
    int tasksCompleted,
    int tasksAttempted,
    double successRate,
    double averageResponseTime,
    long uptime,
    Instant lastError
) implements Serializable {}
