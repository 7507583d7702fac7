package com.orbit.core.memory;

import java.time.Instant;
import java.util.Map;

/**
 * A stored memory.
 */
public record Memory(
    String id,
    MemoryType type,
    Map<String, Object> content,
    double importance,
    Instant timestamp
) {}
