package com.orbit.core.memory;

import com.orbit.core.config.AgentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Bounded in-memory {@link MemoryStore}; the oldest memory is evicted once capacity is reached.
 */
@Service
public class InMemoryMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMemoryStore.class);

    private final int capacity;
    private final Clock clock;
    private final Deque<Memory> memories = new ArrayDeque<>();

    @Autowired
    public InMemoryMemoryStore(AgentProperties properties, Clock clock) {
        this(properties.getMemoryCapacity(), clock);
    }

    public InMemoryMemoryStore(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Memory capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    @Override
    public synchronized void store(MemoryEntry entry) {
        var memory = new Memory(
                UUID.randomUUID().toString(),
                entry.type(),
                entry.content() == null ? Map.of() : Map.copyOf(entry.content()),
                Math.max(0.0, Math.min(1.0, entry.importance())),
                clock.instant());

        if (memories.size() >= capacity) {
            Memory evicted = memories.removeFirst();
            log.debug("Memory capacity {} reached, evicted {}", capacity, evicted.id());
        }
        memories.addLast(memory);
        log.debug("Memory stored: type={}, importance={}", memory.type(), memory.importance());
    }

    @Override
    public synchronized List<Memory> recent(int limit) {
        var result = new ArrayList<Memory>();
        Iterator<Memory> it = memories.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    @Override
    public synchronized List<Memory> byType(MemoryType type) {
        return memories.stream().filter(m -> m.type() == type).toList();
    }

    @Override
    public synchronized int size() {
        return memories.size();
    }
}
