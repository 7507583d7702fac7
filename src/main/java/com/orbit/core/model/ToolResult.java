package com.orbit.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Result of executing a tool or plan step.
 *
 * @param success   whether the execution succeeded
 * @param data      opaque result payload (nullable)
 * @param error     error message when unsuccessful (nullable)
 * @param duration  milliseconds spent
 * @param timestamp completion time
 */
public record ToolResult(
    boolean success,
    Object data,
    String error,
    long duration,
    Instant timestamp
) implements Serializable {

    public static ToolResult success(Object data, long duration, Instant timestamp) {
        return new ToolResult(true, data, null, duration, timestamp);
    }

    public static ToolResult failure(String error, long duration, Instant timestamp) {
        return new ToolResult(false, null, error, duration, timestamp);
    }
}
