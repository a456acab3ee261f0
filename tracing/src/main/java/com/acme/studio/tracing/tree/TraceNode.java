package com.acme.studio.tracing.tree;

import com.acme.studio.tracing.report.TraceErrorData;
import com.acme.studio.tracing.report.TraceNodeData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Timing record for one field resolution. Offsets are nanoseconds relative to the request's
 * monotonic start. Every mutator fails once the owning {@link TraceTree} is sealed.
 */
public final class TraceNode {
    private static final long UNSET = -1L;

    private final TraceTree tree;
    private final ResponsePath path;
    private final List<TraceNode> children = new ArrayList<>();
    private final List<TraceErrorData> errors = new ArrayList<>();

    private String type;
    private String parentType;
    private String originalFieldName;
    private long startTime = UNSET;
    private long endTime = UNSET;

    TraceNode(TraceTree tree, ResponsePath path) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.path = Objects.requireNonNull(path, "path");
    }

    public ResponsePath path() {
        return path;
    }

    public String type() {
        return type;
    }

    public String parentType() {
        return parentType;
    }

    public String originalFieldName() {
        return originalFieldName;
    }

    public long startTime() {
        return startTime;
    }

    public long endTime() {
        return endTime;
    }

    public boolean hasStarted() {
        return startTime != UNSET;
    }

    public boolean hasEnded() {
        return endTime != UNSET;
    }

    public List<TraceErrorData> errors() {
        return Collections.unmodifiableList(errors);
    }

    public List<TraceNode> children() {
        return Collections.unmodifiableList(children);
    }

    public void setType(String type) {
        tree.checkMutable();
        this.type = type;
    }

    public void setParentType(String parentType) {
        tree.checkMutable();
        this.parentType = parentType;
    }

    public void setOriginalFieldName(String originalFieldName) {
        tree.checkMutable();
        this.originalFieldName = originalFieldName;
    }

    public void recordStart(long offsetNanos) {
        tree.checkMutable();
        this.startTime = offsetNanos;
    }

    /**
     * Sets the end offset. Lazy resolution calls this again to push the end out, which is
     * allowed until the tree is sealed.
     */
    public void recordEnd(long offsetNanos) {
        tree.checkMutable();
        if (startTime == UNSET) {
            throw new IllegalStateException("end time recorded before start time for " + path);
        }
        this.endTime = offsetNanos;
    }

    void addError(TraceErrorData error) {
        tree.checkMutable();
        errors.add(error);
    }

    void addChild(TraceNode child) {
        children.add(child);
    }

    TraceNodeData toNodeData() {
        String responseName = null;
        Integer index = null;
        if (!path.isRoot()) {
            PathSegment last = path.last();
            if (last instanceof PathSegment.Index i) {
                index = i.index();
            } else {
                responseName = ((PathSegment.Field) last).name();
            }
        }
        List<TraceNodeData> childData = new ArrayList<>(children.size());
        for (TraceNode child : children) {
            childData.add(child.toNodeData());
        }
        return new TraceNodeData(
            responseName,
            index,
            type,
            parentType,
            originalFieldName,
            startTime == UNSET ? 0L : startTime,
            endTime == UNSET ? 0L : endTime,
            List.copyOf(errors),
            childData
        );
    }
}
