package com.questrail.memmap.codec.impl;

import com.questrail.memmap.codec.EncodingException;

import java.nio.ByteOrder;
import java.util.Objects;

/**
 * BitfieldCodec
 * -----------------------------------------------------------------------------
 * Sub-range of bits inside an unsigned integer carrier of 1 to 4 bytes.
 *
 * <p>The carrier is decoded as an integer in its own byte order first, and the
 * member is addressed inside that integer. {@code bitOffset} counts from the
 * carrier's most significant bit, so for an 8-bit carrier declared
 * {@code a:4, b:4} member {@code a} has offset 0 (high nibble) and {@code b}
 * offset 4 (low nibble).</p>
 *
 * <p>Writing is read-modify-write on the carrier: {@link #encode(long, byte[])}
 * takes the current carrier bytes and returns new carrier bytes in which only
 * this member's bits differ. Sibling members sharing the carrier are
 * untouched.</p>
 *
 * <p>Single bits of {@code bit}/{@code lbit} arrays are one-bit members of a
 * one-byte carrier.</p>
 */
public final class BitfieldCodec
{
    private final IntegerCodec carrier;
    private final int bitOffset;
    private final int width;
    private final int shift;
    private final long mask;

    public BitfieldCodec(int carrierBytes, ByteOrder order, int bitOffset, int width)
    {
        this.carrier = IntegerCodec.unsigned(carrierBytes, order);
        final int carrierBits = carrierBytes * 8;
        if (width < 1 || bitOffset < 0 || bitOffset + width > carrierBits) {
            throw new IllegalArgumentException(String.format(
                    "Bit range offset=%d width=%d does not fit a %d-bit carrier",
                    bitOffset, width, carrierBits));
        }
        this.bitOffset = bitOffset;
        this.width = width;
        this.shift = carrierBits - bitOffset - width;
        this.mask = ((1L << width) - 1) << shift;
    }

    public int carrierBytes()
    {
        return carrier.byteLength();
    }

    public int width()
    {
        return width;
    }

    public int bitOffset()
    {
        return bitOffset;
    }

    /**
     * Largest value this member can hold.
     */
    public long max()
    {
        return (1L << width) - 1;
    }

    /**
     * Extracts this member's value from the carrier bytes.
     */
    public long decode(byte[] carrierRaw)
    {
        return (carrier.decodeLong(carrierRaw) & mask) >>> shift;
    }

    /**
     * Returns new carrier bytes with this member set to {@code value}.
     *
     * @param value      new member value, {@code 0 .. max()}
     * @param carrierRaw current carrier bytes (not modified)
     * @throws EncodingException if {@code value} does not fit in {@link #width()} bits
     */
    public byte[] encode(long value, byte[] carrierRaw)
    {
        Objects.requireNonNull(carrierRaw, "carrierRaw");
        if (value < 0 || value > max()) {
            throw new EncodingException(String.format(
                    "%d does not fit a %d-bit field [0, %d]", value, width, max()));
        }
        final long current = carrier.decodeLong(carrierRaw);
        final long updated = (current & ~mask) | (value << shift);
        return carrier.encodeLong(updated);
    }

    @Override
    public String toString()
    {
        return "BitfieldCodec[offset=" + bitOffset + ", width=" + width + ", carrier=" + carrier + ']';
    }
}
