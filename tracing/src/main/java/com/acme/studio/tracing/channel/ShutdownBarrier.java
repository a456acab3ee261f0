package com.acme.studio.tracing.channel;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot shutdown signal. Firing is idempotent and releases every waiter.
 */
public final class ShutdownBarrier {
    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * Blocks until the barrier fires or {@code timeout} elapses.
     *
     * @return {@code true} if the barrier fired, {@code false} on timeout
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void fire() {
        latch.countDown();
    }

    public boolean hasFired() {
        return latch.getCount() == 0L;
    }
}
