package com.orbit.core.memory;

public enum MemoryType {
    EPISODIC,
    SEMANTIC,
    PROCEDURAL
}
