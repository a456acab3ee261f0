package com.acme.studio.tracing.report;

import java.time.Instant;

/**
 * Wall-clock instant split into epoch seconds and nanos, as the ingress schema expects.
 */
public record Timestamp(long seconds, int nanos) {
    public static Timestamp of(Instant instant) {
        return new Timestamp(instant.getEpochSecond(), instant.getNano());
    }
}
