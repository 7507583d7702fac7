package com.orbit.core.guardrail;

/**
 * Reports current heap usage in megabytes.
 */
@FunctionalInterface
public interface HeapUsageProbe {

    double usedHeapMb();

    static HeapUsageProbe runtime() {
        return () -> {
            Runtime rt = Runtime.getRuntime();
            return (rt.totalMemory() - rt.freeMemory()) / 1024.0 / 1024.0;
        };
    }
}
