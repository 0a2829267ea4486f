package com.questrail.memmap.layout;

import com.questrail.memmap.schema.PrimitiveKind;

import java.util.Objects;

/**
 * A placed integer, BCD or character field.
 *
 * @param length character count, BCD digit-pair count, or 1 for integers
 */
public record ResolvedPrimitive(String name, PrimitiveKind kind, int length, int byteOffset)
        implements ResolvedNode {

    public ResolvedPrimitive {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (kind.family() == PrimitiveKind.Family.BIT) {
            throw new IllegalArgumentException("Bits are placed as ResolvedBitfield");
        }
    }

    @Override
    public int byteSize() {
        return kind.byteWidth() * length;
    }
}
