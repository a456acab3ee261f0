package com.acme.studio.tracing.collector;

import com.acme.studio.tracing.tree.ResponsePath;

import java.util.Objects;

/**
 * Engine metadata for one field callback.
 *
 * @param path       response path of the field, ending in its response (possibly aliased) name
 *                   or, for lazy list elements, the element index
 * @param fieldName  schema name of the field
 * @param fieldType  type signature, e.g. {@code [Post!]!}
 * @param parentType name of the object type declaring the field
 * @param listType   whether the field's type is a list
 */
public record FieldEvent(ResponsePath path, String fieldName, String fieldType, String parentType, boolean listType) {
    public FieldEvent {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(fieldName, "fieldName");
    }

    /** Same field reported at another path, e.g. one element of a lazy list. */
    public FieldEvent withPath(ResponsePath elementPath) {
        return new FieldEvent(elementPath, fieldName, fieldType, parentType, listType);
    }
}
