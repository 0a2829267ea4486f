package com.questrail.memmap.binding;

import java.util.List;

/**
 * A fixed-size array of homogeneous elements, indexed from 0.
 */
public sealed interface BoundArray extends BoundElement permits ArrayView
{
    int size();

    /**
     * @throws com.questrail.memmap.store.OutOfBoundsException if
     *         {@code index} is outside {@code [0, size())}
     */
    BoundElement element(int index);

    BoundPrimitive primitive(int index);

    BoundBitfield bitfield(int index);

    BoundRecord record(int index);

    BoundArray array(int index);

    List<BoundElement> elements();

    /**
     * Assigns every element at once. Values are {@link Number}s, {@link String}s
     * or {@link Boolean}s as {@link Bindings#assign} accepts them. All values are
     * encoded before the first byte is written.
     *
     * @throws com.questrail.memmap.codec.EncodingException if the list size
     *         differs from {@link #size()} or any value does not fit
     * @throws TypeMismatchException if the elements are records or arrays
     */
    void assignAll(List<?> values);

    /**
     * Navigates a relative path such as {@code [3].rxfreq}.
     */
    BoundElement at(String path);
}
