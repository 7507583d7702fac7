package com.orbit.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * An externally supplied unit of intent.
 *
 * @param id          unique identifier
 * @param description what the goal should achieve; its first word drives hint matching
 * @param type        IMMEDIATE or COMPLEX
 * @param priority    base priority, higher is more important (0-10 by convention)
 * @param deadline    optional deadline (nullable)
 * @param status      current status
 * @param createdAt   when the goal was created
 */
public record Goal(
    String id,
    String description,
    GoalType type,
    int priority,
    Instant deadline,
    GoalStatus status,
    Instant createdAt
) implements Serializable {

    public static Goal immediate(String description, int priority, Instant createdAt) {
        return new Goal(UUID.randomUUID().toString(), description, GoalType.IMMEDIATE,
                priority, null, GoalStatus.PENDING, createdAt);
    }

    public static Goal complex(String description, int priority, Instant createdAt) {
        return new Goal(UUID.randomUUID().toString(), description, GoalType.COMPLEX,
                priority, null, GoalStatus.PENDING, createdAt);
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    public Goal withStatus(GoalStatus newStatus) {
        return new Goal(id, description, type, priority, deadline, newStatus, createdAt);
    }

    public Goal withDeadline(Instant newDeadline) {
        return new Goal(id, description, type, priority, newDeadline, status, createdAt);
    }
}
