package com.questrail.memmap.binding;

/**
 * A bitfield member or a single bit of a bit array.
 */
public sealed interface BoundBitfield extends BoundElement permits BitfieldView
{
    /**
     * Width in bits.
     */
    int bitWidth();

    long value();

    /**
     * Whether any bit of the field is set.
     */
    boolean isSet();

    /**
     * Writes the field's bits only; the other bits of the carrier are kept.
     *
     * @throws com.questrail.memmap.codec.EncodingException if the value is
     *         negative or wider than the field
     */
    void assign(long value);

    void assign(boolean value);
}
