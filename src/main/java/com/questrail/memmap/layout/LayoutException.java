package com.questrail.memmap.layout;

import com.questrail.memmap.MemmapException;

/**
 * Indicates that a well-formed field tree cannot be placed in memory.
 *
 * This typically reflects:
 * <ul>
 *   <li>A bitfield group that is not byte-aligned or overflows its carrier</li>
 *   <li>An absolute {@code #seekto} inside a repeated array element</li>
 *   <li>Union members of differing sizes</li>
 *   <li>A layout larger than the declared image size</li>
 * </ul>
 */
public final class LayoutException extends MemmapException
{
    private final String node;

    public LayoutException(String node, String message) {
        super((node.isEmpty() ? "<root>" : node) + ": " + message);
        this.node = node;
    }

    /**
     * Path of the offending node, e.g. {@code .memory[].flags}; empty for the
     * root.
     */
    public String node() {
        return node;
    }
}
