package com.tsvolume.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class BoundedPollerTest {

    @Test
    public void testReturnsOnceConditionHolds() throws InterruptedException {
        BoundedPoller poller = new BoundedPoller(1);
        AtomicInteger calls = new AtomicInteger();

        assertTrue(poller.await(() -> calls.incrementAndGet() >= 3, 1000));
        assertEquals(3, calls.get());
    }

    @Test
    public void testTimesOut() throws InterruptedException {
        BoundedPoller poller = new BoundedPoller(5);
        long start = System.nanoTime();

        assertFalse(poller.await(() -> false, 30));
        assertTrue(System.nanoTime() - start >= 30_000_000L);
    }

    @Test
    public void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedPoller(0));
    }
}
