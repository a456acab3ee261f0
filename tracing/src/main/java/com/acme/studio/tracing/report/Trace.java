package com.acme.studio.tracing.report;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One executed request: wall-clock bounds, monotonic duration, the node tree and the
 * client that sent it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Trace(
    Timestamp startTime,
    Timestamp endTime,
    long durationNs,
    TraceNodeData root,
    String clientName,
    String clientVersion
) {}
