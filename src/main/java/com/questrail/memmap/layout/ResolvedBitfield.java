package com.questrail.memmap.layout;

import com.questrail.memmap.schema.PrimitiveKind;

import java.util.Objects;

/**
 * A placed bitfield member or single bit.
 *
 * <p>{@code byteOffset} and {@link #byteSize()} describe the whole carrier;
 * {@code bitOffset} is counted from the most significant bit of the carrier
 * as decoded in its own byte order. A single bit of a {@code bit} or
 * {@code lbit} array has a one-byte carrier and a width of 1.</p>
 */
public record ResolvedBitfield(String name, PrimitiveKind carrier, int byteOffset, int bitOffset, int bitWidth)
        implements ResolvedNode {

    public ResolvedBitfield {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(carrier, "carrier");
        if (bitWidth < 1 || bitOffset < 0 || bitOffset + bitWidth > carrier.byteWidth() * 8) {
            throw new IllegalArgumentException(String.format(
                    "bits [%d, +%d) do not fit carrier %s", bitOffset, bitWidth, carrier.keyword()));
        }
    }

    @Override
    public int byteSize() {
        return carrier.byteWidth();
    }
}
