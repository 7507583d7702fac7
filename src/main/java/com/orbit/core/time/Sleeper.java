package com.orbit.core.time;

/**
 * Blocking pause used for cycle pacing and backoff.
 * Injected so tests can advance a virtual clock instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}
