package com.acme.studio.tracing.tree;

/**
 * One step of a {@link ResponsePath}: either a response field name or a list index.
 */
public sealed interface PathSegment permits PathSegment.Field, PathSegment.Index {
    record Field(String name) implements PathSegment {
        public Field {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("field name must be non-empty");
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Index(int index) implements PathSegment {
        public Index {
            if (index < 0) {
                throw new IllegalArgumentException("index must be >= 0");
            }
        }

        @Override
        public String toString() {
            return Integer.toString(index);
        }
    }

    static PathSegment index(int index) {
        return new Index(index);
    }
}
