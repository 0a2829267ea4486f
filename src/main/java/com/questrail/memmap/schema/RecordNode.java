package com.questrail.memmap.schema;

import java.util.List;
import java.util.Objects;

/**
 * A struct (children placed one after another) or, when {@code union} is set,
 * a union (every child placed at the same offset).
 *
 * <p>The schema root is an unnamed struct record.</p>
 */
public record RecordNode(String name, List<FieldNode> children, boolean union, int line)
        implements FieldNode {

    public RecordNode {
        Objects.requireNonNull(name, "name");
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    public static RecordNode struct(String name, List<FieldNode> children) {
        return new RecordNode(name, children, false, 0);
    }

    public static RecordNode union(String name, List<FieldNode> children) {
        return new RecordNode(name, children, true, 0);
    }
}
