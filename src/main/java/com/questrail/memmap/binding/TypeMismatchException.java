package com.questrail.memmap.binding;

import com.questrail.memmap.MemmapException;

/**
 * Indicates that a bound element was used as something it is not.
 *
 * This typically reflects:
 * <ul>
 *   <li>Looking up a field name a record does not declare</li>
 *   <li>Reading or assigning a value through a record or array</li>
 *   <li>Assigning a string to an integer, or a number to a character field</li>
 *   <li>A path step that does not match the element it is applied to</li>
 * </ul>
 */
public final class TypeMismatchException extends MemmapException
{
    public TypeMismatchException(String message) {
        super(message);
    }
}
