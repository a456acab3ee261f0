package com.acme.studio.tracing.tree;

import com.acme.studio.tracing.report.TraceErrorData;
import com.acme.studio.tracing.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An error reported by the execution engine in a request's result.
 *
 * @param message   human-readable message
 * @param path      response path the error belongs to, or {@code null} for request-level errors
 * @param locations source locations in the query document
 */
public record ExecutionError(String message, ResponsePath path, List<TraceErrorData.Location> locations) {
    public ExecutionError {
        message = message == null ? "" : message;
        locations = locations == null ? List.of() : List.copyOf(locations);
    }

    public ExecutionError(String message, ResponsePath path) {
        this(message, path, List.of());
    }

    TraceErrorData toErrorData() {
        return new TraceErrorData(message, locations, toJson());
    }

    private String toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("message", message);
        if (!locations.isEmpty()) {
            json.put("locations", locations);
        }
        if (path != null) {
            json.put("path", path.toParts());
        }
        try {
            return JsonCodec.writeString(json);
        } catch (JsonProcessingException e) {
            return "{}";
        }
    }
}
