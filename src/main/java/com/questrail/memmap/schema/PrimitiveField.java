package com.questrail.memmap.schema;

import java.util.Objects;

/**
 * A value-bearing field.
 *
 * <p>{@code length} is the number of units: the character count of a
 * {@code char} field, the digit-pair count of a BCD field, and 1 for integers
 * and single bits. Integer arrays are {@link ArrayNode}s of length-1
 * primitives instead.</p>
 */
public record PrimitiveField(String name, PrimitiveKind kind, int length, int line)
        implements FieldNode {

    public PrimitiveField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive: " + length);
        }
        if (length != 1 && (kind.isInteger() || kind.family() == PrimitiveKind.Family.BIT)) {
            throw new IllegalArgumentException(kind.keyword() + " fields have length 1; use an ArrayNode");
        }
    }

    public PrimitiveField(String name, PrimitiveKind kind) {
        this(name, kind, 1, 0);
    }

    /**
     * Bytes covered by this field; 0 for a single bit.
     */
    public int byteSize() {
        return kind.family() == PrimitiveKind.Family.BIT ? 0 : kind.byteWidth() * length;
    }
}
