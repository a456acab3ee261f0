package com.acme.studio.tracing.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Position of a field in the response, as the ordered list of field names and list indices
 * leading to it. The empty path is the root of the response.
 */
public record ResponsePath(List<PathSegment> segments) {
    public static final ResponsePath ROOT = new ResponsePath(List.of());

    public ResponsePath {
        segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
    }

    /**
     * Builds a path from engine-style parts: {@link String} for field names, {@link Integer} for
     * list indices.
     */
    public static ResponsePath of(Object... parts) {
        List<PathSegment> out = new ArrayList<>(parts.length);
        for (Object part : parts) {
            if (part instanceof Integer i) {
                out.add(new PathSegment.Index(i));
            } else if (part instanceof String s) {
                out.add(new PathSegment.Field(s));
            } else if (part instanceof PathSegment seg) {
                out.add(seg);
            } else {
                throw new IllegalArgumentException("Unsupported path part: " + part);
            }
        }
        return new ResponsePath(out);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    public PathSegment last() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("root path has no last segment");
        }
        return segments.get(segments.size() - 1);
    }

    /** Path without its last segment; the root is its own parent. */
    public ResponsePath parent() {
        if (segments.size() <= 1) {
            return ROOT;
        }
        return new ResponsePath(segments.subList(0, segments.size() - 1));
    }

    public ResponsePath child(PathSegment segment) {
        List<PathSegment> out = new ArrayList<>(segments.size() + 1);
        out.addAll(segments);
        out.add(Objects.requireNonNull(segment, "segment"));
        return new ResponsePath(out);
    }

    public boolean endsWithIndex() {
        return !segments.isEmpty() && last() instanceof PathSegment.Index;
    }

    /** Engine-style rendering: field names as strings, indices as integers. */
    public List<Object> toParts() {
        List<Object> out = new ArrayList<>(segments.size());
        for (PathSegment segment : segments) {
            if (segment instanceof PathSegment.Index index) {
                out.add(index.index());
            } else {
                out.add(((PathSegment.Field) segment).name());
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return toParts().toString();
    }
}
