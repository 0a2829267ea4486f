package com.questrail.memmap.binding;

import com.questrail.memmap.schema.PrimitiveKind;

import java.util.List;

/**
 * An integer, BCD or character field.
 *
 * <p>A BCD or character field declared with a count ({@code bbcd freq[4]},
 * {@code char name[6]}) reads and writes as one value, and its single
 * digit-pair or character bytes are reachable through {@link #element(int)}
 * or a path step such as {@code freq[0]}.</p>
 */
public sealed interface BoundPrimitive extends BoundElement permits PrimitiveView
{
    PrimitiveKind kind();

    /**
     * Character count, BCD pair count, or 1 for integers.
     */
    int length();

    /**
     * The decoded value: a {@link Long} for integer fields and BCD fields of
     * up to nine pairs, a {@link java.math.BigInteger} for wider BCD fields,
     * a {@link String} for character fields.
     */
    Object value();

    /**
     * @throws TypeMismatchException for character fields
     * @throws com.questrail.memmap.codec.EncodingException if a BCD value
     *         exceeds the {@code long} range
     */
    long longValue();

    /**
     * The character string, or the decimal rendering of a numeric value.
     */
    String stringValue();

    /**
     * @throws TypeMismatchException for character fields
     * @throws com.questrail.memmap.codec.EncodingException if the value does
     *         not fit the field
     */
    void assign(long value);

    /**
     * Assigns a character string (padded with the binding's pad byte) or a
     * BCD digit string.
     *
     * @throws TypeMismatchException for integer fields
     * @throws com.questrail.memmap.codec.EncodingException if the value does
     *         not fit the field
     */
    void assign(String value);

    /**
     * Assigns a character string padded with {@code pad}.
     *
     * @throws TypeMismatchException unless this is a character field
     */
    void assign(String value, byte pad);

    /**
     * The one-byte pair or character at {@code index}, in storage order.
     *
     * @throws TypeMismatchException for integer fields
     * @throws com.questrail.memmap.store.OutOfBoundsException if
     *         {@code index} is outside {@code [0, length())}
     */
    BoundPrimitive element(int index);

    List<BoundPrimitive> elements();

    /**
     * The field's raw bits selected by {@code mask}. Bits are numbered over
     * the field's bytes in its byte order, as for an unsigned integer.
     *
     * @throws TypeMismatchException for character fields and fields wider
     *         than eight bytes
     * @throws com.questrail.memmap.codec.EncodingException if {@code mask}
     *         has bits beyond the field
     */
    long bits(long mask);

    /**
     * Sets the raw bits selected by {@code mask}, keeping the others.
     *
     * @see #bits(long)
     */
    void setBits(long mask);

    /**
     * Clears the raw bits selected by {@code mask}, keeping the others.
     *
     * @see #bits(long)
     */
    void clearBits(long mask);
}
