package com.acme.studio.tracing.transport;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking pause between upload attempts.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = delay -> TimeUnit.NANOSECONDS.sleep(delay.toNanos());

    void sleep(Duration delay) throws InterruptedException;
}
