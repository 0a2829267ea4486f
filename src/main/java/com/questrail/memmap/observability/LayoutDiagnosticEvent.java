package com.questrail.memmap.observability;

import java.util.Objects;

/**
 * Record representing a non-fatal observation made while compiling or
 * resolving a schema.
 *
 * @param kind    what was observed
 * @param line    1-based schema line, or 0 if unknown
 * @param offset  layout cursor at the time, or -1 if not applicable
 * @param message human-readable description
 */
public record LayoutDiagnosticEvent(
    Kind kind,
    int line,
    int offset,
    String message
) {
    public enum Kind {
        /** A {@code #printoffset} directive was reached. */
        PRINT_OFFSET,
        /** A {@code #seekto} targeted the current offset. */
        REDUNDANT_SEEK,
        /** A {@code #seekto} moved the cursor backwards. */
        BACKWARD_SEEK,
        /** Bitfield members leave carrier bits undeclared. */
        TRAILING_BITS
    }

    public LayoutDiagnosticEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }
}
