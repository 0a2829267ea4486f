package com.questrail.memmap.schema;

import java.util.Objects;

/**
 * A single element node repeated {@code count} times, contiguously, at a fixed
 * stride. Elements are homogeneous; there is no per-element layout variation.
 */
public record ArrayNode(String name, FieldNode element, int count, int line)
        implements FieldNode {

    public ArrayNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(element, "element");
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        if (element instanceof PositionDirective) {
            throw new IllegalArgumentException("A directive cannot be an array element");
        }
    }

    public ArrayNode(String name, FieldNode element, int count) {
        this(name, element, count, 0);
    }
}
