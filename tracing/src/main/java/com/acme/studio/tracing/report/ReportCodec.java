package com.acme.studio.tracing.report;

import java.io.IOException;

/**
 * Serialization contract between the collector, the channel and the wire.
 * Implementations must be thread-safe.
 */
public interface ReportCodec {
    byte[] encodeTrace(Trace trace) throws IOException;

    Trace decodeTrace(byte[] encoded) throws IOException;

    byte[] encodeReport(Report report) throws IOException;

    /** Human-readable rendering for debug logging. */
    String renderReport(Report report);
}
