package com.questrail.memmap.binding;

import java.util.List;

/**
 * A struct or union; children are addressed by name.
 */
public sealed interface BoundRecord extends BoundElement permits RecordView
{
    /**
     * @throws TypeMismatchException if the record has no such field
     */
    BoundElement field(String name);

    boolean has(String name);

    /**
     * Field names in declaration order.
     */
    List<String> fieldNames();

    BoundPrimitive primitive(String name);

    BoundBitfield bitfield(String name);

    BoundRecord record(String name);

    BoundArray array(String name);

    /**
     * Navigates a relative path such as {@code .memory[3].rxfreq}.
     *
     * @throws TypeMismatchException if a step does not match the element it
     *         is applied to
     * @throws com.questrail.memmap.store.OutOfBoundsException if an index is
     *         out of range
     */
    BoundElement at(String path);
}
