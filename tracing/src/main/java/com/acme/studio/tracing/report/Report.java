package com.acme.studio.tracing.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Upload unit: a header plus traces grouped by query key. Key order is first-seen order.
 */
public record Report(ReportHeader header, Map<String, TracesAndStats> tracesPerQuery) {
    public Report {
        Objects.requireNonNull(header, "header");
        tracesPerQuery = tracesPerQuery == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(tracesPerQuery));
    }

    public int traceCount() {
        int n = 0;
        for (TracesAndStats t : tracesPerQuery.values()) {
            n += t.trace().size();
        }
        return n;
    }

    public record TracesAndStats(List<Trace> trace) {
        public TracesAndStats {
            trace = trace == null ? List.of() : List.copyOf(trace);
        }
    }
}
