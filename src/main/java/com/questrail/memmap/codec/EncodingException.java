package com.questrail.memmap.codec;

import com.questrail.memmap.MemmapException;

/**
 * Indicates that a value cannot be represented by a field's encoding.
 *
 * This typically reflects:
 * <ul>
 *   <li>A number outside the representable range of an integer width</li>
 *   <li>A non-decimal digit, or too many digits, for a BCD field</li>
 *   <li>A string longer than a character array, or containing characters
 *       outside the single-byte range</li>
 *   <li>A raw byte block of the wrong length</li>
 * </ul>
 *
 * Encoding always completes before any byte is written, so a store is never
 * modified by an operation that raises this exception.
 */
public final class EncodingException extends MemmapException
{
    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
