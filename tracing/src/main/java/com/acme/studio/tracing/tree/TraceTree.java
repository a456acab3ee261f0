package com.acme.studio.tracing.tree;

import com.acme.studio.tracing.report.TraceNodeData;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-request tree of {@link TraceNode}s indexed by full response path.
 *
 * <p>Not thread-safe: a tree is built by the single thread executing its request. Once the
 * request completes the tree is {@linkplain #seal() sealed} and only read afterwards.</p>
 *
 * <p>Adding a path materializes any missing ancestors as untimed placeholder nodes, so every
 * node's parent path is always present in the tree.</p>
 */
public final class TraceTree {
    private final Map<ResponsePath, TraceNode> nodes = new HashMap<>();
    private final TraceNode root;
    private boolean sealed;

    public TraceTree() {
        this.root = new TraceNode(this, ResponsePath.ROOT);
        nodes.put(ResponsePath.ROOT, root);
    }

    public TraceNode root() {
        return root;
    }

    /**
     * Returns the node at {@code path}, creating it (and any missing ancestors) if absent.
     */
    public TraceNode add(ResponsePath path) {
        TraceNode existing = nodes.get(path);
        if (existing != null) {
            return existing;
        }
        checkMutable();
        TraceNode parent = add(path.parent());
        TraceNode node = new TraceNode(this, path);
        parent.addChild(node);
        nodes.put(path, node);
        return node;
    }

    /**
     * @throws NodeNotFoundException if {@code path} was never added
     */
    public TraceNode nodeFor(ResponsePath path) {
        TraceNode node = nodes.get(path);
        if (node == null) {
            throw new NodeNotFoundException(path);
        }
        return node;
    }

    public boolean contains(ResponsePath path) {
        return nodes.containsKey(path);
    }

    /**
     * Attaches an engine error to the node at its path, or to the closest ancestor present in
     * the tree. Errors without a path land on the root. Unknown paths never fail; the tree must
     * not be sealed yet.
     *
     * @throws IllegalStateException if the tree is already sealed
     */
    public TraceNode addError(ExecutionError error) {
        ResponsePath p = error.path() == null ? ResponsePath.ROOT : error.path();
        while (!nodes.containsKey(p)) {
            p = p.parent();
        }
        TraceNode node = nodes.get(p);
        node.addError(error.toErrorData());
        return node;
    }

    /** Number of nodes, root included. */
    public int size() {
        return nodes.size();
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public TraceNodeData toNodeData() {
        return root.toNodeData();
    }

    void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("trace tree is sealed");
        }
    }
}
