package com.acme.studio.tracing.report;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Immutable wire form of a trace node. Exactly one of {@code responseName} and {@code index}
 * is set, except on the root where both are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceNodeData(
    String responseName,
    Integer index,
    String type,
    String parentType,
    String originalFieldName,
    long startTime,
    long endTime,
    List<TraceErrorData> error,
    List<TraceNodeData> child
) {
    public TraceNodeData {
        error = error == null ? List.of() : List.copyOf(error);
        child = child == null ? List.of() : List.copyOf(child);
    }
}
