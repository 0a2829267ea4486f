package com.questrail.memmap.schema;

import java.util.Objects;

/**
 * CompiledSchema
 * -----------------------------------------------------------------------------
 * Immutable result of compiling schema text: the source text (its identity for
 * caching) and the root of the field tree.
 *
 * <p>A compiled schema holds no offsets and no buffer; it is reused across
 * every image of the same device model.</p>
 */
public record CompiledSchema(String source, RecordNode root) {

    public CompiledSchema {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(root, "root");
    }

    /**
     * Wraps a programmatically built tree. The source is empty.
     */
    public static CompiledSchema of(RecordNode root) {
        return new CompiledSchema("", root);
    }

    @Override
    public String toString() {
        return "CompiledSchema[fields=" + root.children().size()
                + ", sourceLength=" + source.length() + ']';
    }
}
