package com.questrail.memmap;

/**
 * MemmapException
 * -----------------------------------------------------------------------------
 * Common supertype of every failure raised by the layout engine.
 *
 * <p>The engine never recovers internally. Each subtype identifies the stage
 * that rejected the operation:</p>
 * <ul>
 *   <li>{@code SchemaSyntaxException}: malformed schema text (compile)</li>
 *   <li>{@code LayoutException}: structurally unplaceable field tree (resolve)</li>
 *   <li>{@code OutOfBoundsException}: array index or byte range out of range</li>
 *   <li>{@code TypeMismatchException}: unknown field, wrong element shape</li>
 *   <li>{@code EncodingException}: value not representable by a field</li>
 * </ul>
 */
public abstract class MemmapException extends RuntimeException
{
    protected MemmapException(String message) {
        super(message);
    }

    protected MemmapException(String message, Throwable cause) {
        super(message, cause);
    }
}
