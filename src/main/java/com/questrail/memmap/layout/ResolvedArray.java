package com.questrail.memmap.layout;

import com.questrail.memmap.schema.PrimitiveKind;

import java.util.Objects;

/**
 * A placed array. Only element 0 is resolved; element {@code i} is the same
 * template shifted by {@code i * elementSize} bytes.
 *
 * <p>Bit arrays are the exception: their elements are single bits packed eight
 * to a byte, so {@code elementSize} is 0 and {@link #bitAt(int)} places each
 * element.</p>
 */
public record ResolvedArray(String name, int byteOffset, int count, int elementSize, ResolvedNode element)
        implements ResolvedNode {

    public ResolvedArray {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(element, "element");
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
    }

    /**
     * Whether the elements are single bits of a {@code bit} or {@code lbit}
     * array.
     */
    public boolean bitArray() {
        return element instanceof ResolvedBitfield b && b.carrier().family() == PrimitiveKind.Family.BIT;
    }

    @Override
    public int byteSize() {
        return bitArray() ? count / 8 : count * elementSize;
    }

    /**
     * Absolute byte offset of element {@code index}; for bit arrays the byte
     * holding that bit.
     */
    public int elementOffset(int index) {
        checkIndex(index);
        return bitArray() ? byteOffset + index / 8 : byteOffset + index * elementSize;
    }

    /**
     * Places bit {@code index} of a bit array. {@code bit} arrays count from
     * the most significant bit of each byte, {@code lbit} arrays from the
     * least significant.
     */
    public ResolvedBitfield bitAt(int index) {
        if (!bitArray()) {
            throw new IllegalStateException(name + " is not a bit array");
        }
        checkIndex(index);
        ResolvedBitfield bit = (ResolvedBitfield) element;
        int withinByte = index % 8;
        int fromMsb = bit.carrier() == PrimitiveKind.LBIT ? 7 - withinByte : withinByte;
        return new ResolvedBitfield(bit.name(), bit.carrier(), byteOffset + index / 8, fromMsb, 1);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("index " + index + " outside [0, " + count + ")");
        }
    }
}
