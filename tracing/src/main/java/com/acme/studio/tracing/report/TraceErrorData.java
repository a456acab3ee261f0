package com.acme.studio.tracing.report;

import java.util.List;

/**
 * Error attached to a trace node.
 *
 * @param json full JSON rendering of the engine error
 */
public record TraceErrorData(String message, List<Location> location, String json) {
    public TraceErrorData {
        location = location == null ? List.of() : List.copyOf(location);
    }

    public record Location(int line, int column) {}
}
