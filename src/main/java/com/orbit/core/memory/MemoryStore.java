package com.orbit.core.memory;

import java.util.List;

/**
 * Append-only episodic log used by agents. Writes are fire-and-forget.
 */
public interface MemoryStore {

    void store(MemoryEntry entry);

    /**
     * Most recent memories, newest first.
     */
    List<Memory> recent(int limit);

    List<Memory> byType(MemoryType type);

    int size();
}
