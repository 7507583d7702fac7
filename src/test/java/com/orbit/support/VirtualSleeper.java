package com.orbit.support;

import com.orbit.core.time.Sleeper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongConsumer;

/**
 * Records requested sleeps and advances a {@link VirtualClock} instead of blocking.
 * A hook runs after every sleep so tests can stop an agent at a chosen point.
 */
public class VirtualSleeper implements Sleeper {

    private final VirtualClock clock;
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();
    private volatile LongConsumer afterSleep = ms -> {};

    public VirtualSleeper(VirtualClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException();
        }
        sleeps.add(millis);
        clock.advanceMillis(millis);
        afterSleep.accept(millis);
        Thread.yield();
    }

    public void afterSleep(LongConsumer hook) {
        this.afterSleep = hook;
    }

    public List<Long> sleeps() {
        return List.copyOf(sleeps);
    }

    public long count(long millis) {
        return sleeps.stream().filter(s -> s == millis).count();
    }
}
