package com.orbit.core.memory;

import java.util.Map;

/**
 * Something an agent wants remembered.
 *
 * @param type       memory kind
 * @param content    key-value payload
 * @param importance 0-1, clamped on store
 */
public record MemoryEntry(
    MemoryType type,
    Map<String, Object> content,
    double importance
) {

    public static MemoryEntry episodic(Map<String, Object> content, double importance) {
        return new MemoryEntry(MemoryType.EPISODIC, content, importance);
    }
}
