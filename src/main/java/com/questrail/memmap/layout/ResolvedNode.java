package com.questrail.memmap.layout;

/**
 * ResolvedNode
 * -----------------------------------------------------------------------------
 * A field tree node with its position in the image fixed.
 *
 * <p>Every node carries {@code (byteOffset, bitOffset, bitWidth)}. For
 * byte-granular nodes {@code bitOffset} is 0 and {@code bitWidth} is
 * {@code 8 * byteSize()}. Bit offsets are counted from the most significant bit
 * of the node's carrier.</p>
 *
 * <p>Resolved nodes are immutable values; two resolutions of the same schema
 * are {@code equals}.</p>
 */
public sealed interface ResolvedNode
        permits ResolvedPrimitive, ResolvedBitfield, ResolvedRecord, ResolvedArray
{
    String name();

    int byteOffset();

    int byteSize();

    default int bitOffset() {
        return 0;
    }

    default int bitWidth() {
        return byteSize() * 8;
    }
}
