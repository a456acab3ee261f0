package com.acme.studio.tracing.collector;

/**
 * One query of a (possibly multiplexed) execution, as seen by the tracer.
 */
public interface ExecutionQuery {
    /** Operation name, or {@code null} for anonymous operations. */
    String operationName();

    String queryString();

    RequestContext context();
}
