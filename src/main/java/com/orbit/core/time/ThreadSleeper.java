package com.orbit.core.time;

/**
 * {@link Sleeper} backed by {@link Thread#sleep(long)}.
 */
public class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
