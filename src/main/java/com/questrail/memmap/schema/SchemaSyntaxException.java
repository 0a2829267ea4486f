package com.questrail.memmap.schema;

import com.questrail.memmap.MemmapException;

/**
 * Indicates that schema text is malformed. Compilation aborts wholly; no
 * partial schema is ever produced.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unknown type keyword or struct type name</li>
 *   <li>Unbalanced braces or a missing {@code ;}</li>
 *   <li>Bitfield widths that do not sum to a whole number of bytes</li>
 *   <li>An array count that is not a positive integer</li>
 *   <li>A field name declared twice in one record</li>
 * </ul>
 */
public final class SchemaSyntaxException extends MemmapException
{
    private final int line;

    public SchemaSyntaxException(int line, String message) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    /**
     * 1-based line of the offending schema text.
     */
    public int line() {
        return line;
    }
}
