package com.questrail.memmap.codec.impl;

import com.questrail.memmap.codec.EncodingException;
import com.questrail.memmap.codec.ValueCodec;

import java.nio.ByteOrder;
import java.util.Objects;

/**
 * IntegerCodec
 * -----------------------------------------------------------------------------
 * Two's-complement integers of 1 to 4 bytes in either byte order.
 *
 * <p>Endianness selects byte order only; bit order within a byte is always
 * most-significant-bit first. Values are carried as {@code long} so that the
 * full unsigned 32-bit range is representable.</p>
 *
 * <p>Range is exact. An unsigned codec of width {@code w} bits accepts
 * {@code [0, 2^w)}, a signed one {@code [-2^(w-1), 2^(w-1))}. Anything else is
 * an {@link EncodingException}, never a silent modulo.</p>
 */
public final class IntegerCodec implements ValueCodec<Long>
{
    private final int byteWidth;
    private final boolean signed;
    private final ByteOrder order;
    private final long min;
    private final long max;

    public IntegerCodec(int byteWidth, boolean signed, ByteOrder order)
    {
        if (byteWidth < 1 || byteWidth > 4) {
            throw new IllegalArgumentException("byteWidth must be 1..4: " + byteWidth);
        }
        this.byteWidth = byteWidth;
        this.signed = signed;
        this.order = Objects.requireNonNull(order, "order");

        final int bits = byteWidth * 8;
        if (signed) {
            this.min = -(1L << (bits - 1));
            this.max = (1L << (bits - 1)) - 1;
        } else {
            this.min = 0;
            this.max = (1L << bits) - 1;
        }
    }

    /**
     * Unsigned codec used as the carrier of bitfields and single bits.
     */
    public static IntegerCodec unsigned(int byteWidth, ByteOrder order)
    {
        return new IntegerCodec(byteWidth, false, order);
    }

    @Override
    public int byteLength()
    {
        return byteWidth;
    }

    public boolean signed()
    {
        return signed;
    }

    public long min()
    {
        return min;
    }

    public long max()
    {
        return max;
    }

    @Override
    public Long decode(byte[] raw)
    {
        return decodeLong(raw);
    }

    /**
     * Primitive form of {@link #decode(byte[])}.
     */
    public long decodeLong(byte[] raw)
    {
        checkLength(raw);

        long value = 0;
        for (int i = 0; i < byteWidth; i++) {
            int idx = (order == ByteOrder.BIG_ENDIAN) ? i : byteWidth - 1 - i;
            value = (value << 8) | (raw[idx] & 0xFF);
        }

        if (signed) {
            final int bits = byteWidth * 8;
            if ((value & (1L << (bits - 1))) != 0) {
                value -= (1L << bits);
            }
        }
        return value;
    }

    @Override
    public byte[] encode(Long value)
    {
        Objects.requireNonNull(value, "value");
        return encodeLong(value);
    }

    /**
     * Primitive form of {@link #encode(Long)}.
     *
     * @throws EncodingException if {@code value} is outside {@code [min, max]}
     */
    public byte[] encodeLong(long value)
    {
        if (value < min || value > max) {
            throw new EncodingException(String.format(
                    "%d is outside the range of a %s %d-bit integer [%d, %d]",
                    value, signed ? "signed" : "unsigned", byteWidth * 8, min, max));
        }

        final byte[] out = new byte[byteWidth];
        long v = value;
        for (int i = 0; i < byteWidth; i++) {
            int idx = (order == ByteOrder.BIG_ENDIAN) ? byteWidth - 1 - i : i;
            out[idx] = (byte) (v & 0xFF);
            v >>= 8;
        }
        return out;
    }

    private void checkLength(byte[] raw)
    {
        Objects.requireNonNull(raw, "raw");
        if (raw.length != byteWidth) {
            throw new IllegalArgumentException(
                    "Expected " + byteWidth + " bytes, got " + raw.length);
        }
    }

    @Override
    public String toString()
    {
        return "IntegerCodec[" + (signed ? "i" : "u") + (byteWidth * 8)
                + (order == ByteOrder.LITTLE_ENDIAN ? "le" : "be") + ']';
    }
}
