package com.questrail.memmap.store;

import com.questrail.memmap.MemmapException;

/**
 * Indicates an access outside a declared range: an array index beyond the
 * declared element count, or a byte range extending past the end of a
 * {@link BackingStore}.
 */
public final class OutOfBoundsException extends MemmapException
{
    public OutOfBoundsException(String message) {
        super(message);
    }
}
