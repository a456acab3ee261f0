package com.acme.studio.tracing.collector;

import java.util.Optional;

/**
 * Per-request state passed through the engine callbacks: whether the request is traced,
 * which client sent it, and the trace being built for it.
 */
public final class RequestContext {
    private final boolean tracingEnabled;
    private final String clientName;
    private final String clientVersion;
    private TraceState trace;

    public RequestContext(boolean tracingEnabled, String clientName, String clientVersion) {
        this.tracingEnabled = tracingEnabled;
        this.clientName = clientName;
        this.clientVersion = clientVersion;
    }

    public static RequestContext traced() {
        return new RequestContext(true, null, null);
    }

    public static RequestContext untraced() {
        return new RequestContext(false, null, null);
    }

    public boolean tracingEnabled() {
        return tracingEnabled;
    }

    public String clientName() {
        return clientName;
    }

    public String clientVersion() {
        return clientVersion;
    }

    public Optional<TraceState> trace() {
        return Optional.ofNullable(trace);
    }

    void attachTrace(TraceState trace) {
        this.trace = trace;
    }
}
