package com.acme.studio.tracing.collector;

import com.acme.studio.tracing.tree.ExecutionError;

import java.util.List;

/**
 * Result of one executed query: the query it belongs to and the errors in its response.
 */
public interface ExecutionResult {
    ExecutionQuery query();

    List<ExecutionError> errors();
}
