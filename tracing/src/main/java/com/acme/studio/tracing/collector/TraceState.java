package com.acme.studio.tracing.collector;

import com.acme.studio.tracing.report.Timestamp;
import com.acme.studio.tracing.report.Trace;
import com.acme.studio.tracing.tree.TraceTree;

import java.time.Instant;
import java.util.Objects;

/**
 * In-progress trace of one request: its start times, node tree and, once the query has
 * finished, its end times.
 */
public final class TraceState {
    private final Instant startTime;
    private final long startNanos;
    private final TraceTree tree;
    private Instant endTime;
    private long endNanos;

    TraceState(Instant startTime, long startNanos, TraceTree tree) {
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.startNanos = startNanos;
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    public TraceTree tree() {
        return tree;
    }

    public Instant startTime() {
        return startTime;
    }

    public long startNanos() {
        return startNanos;
    }

    public boolean hasEnded() {
        return endTime != null;
    }

    /** Nanoseconds since the request started. */
    long offsetOf(long monotonicNanos) {
        return monotonicNanos - startNanos;
    }

    void recordEnd(Instant endTime, long endNanos) {
        this.endTime = Objects.requireNonNull(endTime, "endTime");
        this.endNanos = endNanos;
    }

    Trace toTrace(String clientName, String clientVersion) {
        if (endTime == null) {
            throw new IllegalStateException("trace has not ended");
        }
        return new Trace(
            Timestamp.of(startTime),
            Timestamp.of(endTime),
            endNanos - startNanos,
            tree.toNodeData(),
            clientName,
            clientVersion
        );
    }
}
