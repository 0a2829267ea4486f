package com.questrail.memmap.schema;

import java.util.Objects;

/**
 * A schema instruction that affects the layout cursor (or reports it) rather
 * than declaring a field.
 *
 * <ul>
 *   <li>{@code #seekto 0x1AB;}: {@link Kind#SEEK_TO}: cursor = value</li>
 *   <li>{@code #seek 4;}: {@link Kind#SKIP}: cursor += value</li>
 *   <li>{@code #printoffset "label";}: {@link Kind#PRINT_OFFSET}: report the cursor</li>
 * </ul>
 */
public record PositionDirective(Kind kind, long value, String label, int line)
        implements FieldNode {

    public enum Kind { SEEK_TO, SKIP, PRINT_OFFSET }

    public PositionDirective {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(label, "label");
        if (value < 0) {
            throw new IllegalArgumentException("value must be non-negative: " + value);
        }
    }

    public static PositionDirective seekTo(long address) {
        return new PositionDirective(Kind.SEEK_TO, address, "", 0);
    }

    public static PositionDirective skip(long bytes) {
        return new PositionDirective(Kind.SKIP, bytes, "", 0);
    }

    public static PositionDirective printOffset(String label) {
        return new PositionDirective(Kind.PRINT_OFFSET, 0, label, 0);
    }
}
