package com.tsvolume.util;

import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Waits for a condition by checking it at a fixed interval until a deadline.
 */
public final class BoundedPoller {

    private final long intervalMs;

    public BoundedPoller(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        this.intervalMs = intervalMs;
    }

    /**
     * @return true if the condition held before the timeout elapsed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (!condition.getAsBoolean()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.sleep(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(intervalMs)));
        }
        return true;
    }

    public long getIntervalMs() {
        return intervalMs;
    }
}
