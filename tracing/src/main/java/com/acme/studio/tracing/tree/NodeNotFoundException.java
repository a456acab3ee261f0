package com.acme.studio.tracing.tree;

/**
 * Thrown when a trace node is looked up by a path that was never added to its tree.
 * Callers only look up paths they added, so this signals out-of-order engine callbacks.
 */
public final class NodeNotFoundException extends RuntimeException {
    private final ResponsePath path;

    public NodeNotFoundException(ResponsePath path) {
        super("No trace node for path " + path);
        this.path = path;
    }

    public ResponsePath path() {
        return path;
    }
}
