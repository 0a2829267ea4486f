package com.questrail.memmap.codec.impl;

import com.questrail.memmap.codec.EncodingException;
import com.questrail.memmap.codec.ValueCodec;

import java.math.BigInteger;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * BcdCodec
 * -----------------------------------------------------------------------------
 * Binary-coded decimal numbers spread over {@code length} digit-pair bytes.
 *
 * <p>Each byte holds two decimal digits: the high nibble is the tens digit, the
 * low nibble the ones digit. The byte order selects where the most significant
 * pair lives:</p>
 * <ul>
 *   <li>{@link ByteOrder#BIG_ENDIAN} ({@code bbcd}): first byte most significant;
 *       {@code 12 34} decodes to 1234</li>
 *   <li>{@link ByteOrder#LITTLE_ENDIAN} ({@code lbcd}): last byte most significant;
 *       {@code 12 34} decodes to 3412</li>
 * </ul>
 *
 * <p>Decoding multiplies nibbles out positionally, so a nibble above 9 read
 * from a device image still yields a number ({@code C7 54} as bbcd is
 * 12754). Encoding is strict: negative numbers, numbers needing more than
 * {@code 2 * length} digits, and digit strings containing anything other than
 * {@code 0-9} are rejected.</p>
 *
 * <p>The value type is {@link BigInteger} since a field may hold any number of
 * pairs. {@link #decodeLong(byte[])} is exact and fails once the decoded
 * number leaves the {@code long} range; fields of up to {@link #LONG_PAIRS}
 * pairs always fit.</p>
 */
public final class BcdCodec implements ValueCodec<BigInteger>
{
    /**
     * Widest field whose decoded value always fits a {@code long}, lenient
     * nibbles included.
     */
    public static final int LONG_PAIRS = 9;

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final int length;
    private final ByteOrder order;

    public BcdCodec(int length, ByteOrder order)
    {
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive: " + length);
        }
        this.length = length;
        this.order = Objects.requireNonNull(order, "order");
    }

    @Override
    public int byteLength()
    {
        return length;
    }

    /**
     * Maximum number of decimal digits this field can hold.
     */
    public int digitCapacity()
    {
        return length * 2;
    }

    /**
     * Whether every decoded value of this field fits a {@code long}.
     */
    public boolean fitsLong()
    {
        return length <= LONG_PAIRS;
    }

    @Override
    public BigInteger decode(byte[] raw)
    {
        checkLength(raw);

        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < length; i++) {
            value = value.multiply(HUNDRED).add(BigInteger.valueOf(pair(raw, i)));
        }
        return value;
    }

    /**
     * Exact {@code long} form of {@link #decode(byte[])}.
     *
     * @throws EncodingException if the decoded number exceeds
     *         {@link Long#MAX_VALUE}
     */
    public long decodeLong(byte[] raw)
    {
        checkLength(raw);
        if (fitsLong()) {
            long value = 0;
            for (int i = 0; i < length; i++) {
                value = (value * 100) + pair(raw, i);
            }
            return value;
        }

        final BigInteger value = decode(raw);
        if (value.bitLength() > 63) {
            throw new EncodingException(String.format(
                    "%s-pair BCD value %s does not fit a long", length, value));
        }
        return value.longValue();
    }

    @Override
    public byte[] encode(BigInteger value)
    {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new EncodingException("BCD cannot encode negative value " + value);
        }
        return encodeDigits(value.toString());
    }

    /**
     * Primitive form of {@link #encode(BigInteger)}.
     */
    public byte[] encodeLong(long value)
    {
        if (value < 0) {
            throw new EncodingException("BCD cannot encode negative value " + value);
        }
        return encodeDigits(Long.toString(value));
    }

    /**
     * Encodes a string of decimal digits. Shorter strings are left-padded with
     * zeros.
     *
     * @throws EncodingException if {@code digits} is empty, contains a
     *         non-decimal character, or exceeds {@link #digitCapacity()}
     */
    public byte[] encodeDigits(String digits)
    {
        Objects.requireNonNull(digits, "digits");
        if (digits.isEmpty()) {
            throw new EncodingException("BCD digit string must not be empty");
        }
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                throw new EncodingException(
                        "Non-decimal digit '" + c + "' in BCD value \"" + digits + '"');
            }
        }
        if (digits.length() > digitCapacity()) {
            throw new EncodingException(String.format(
                    "%s needs %d digits; field holds %d",
                    digits, digits.length(), digitCapacity()));
        }

        final String padded = "0".repeat(digitCapacity() - digits.length()) + digits;
        final byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            int tens = padded.charAt(i * 2) - '0';
            int ones = padded.charAt(i * 2 + 1) - '0';
            out[significantIndex(i)] = (byte) ((tens << 4) | ones);
        }
        return out;
    }

    /*
     * Positional value of the pair at significance rank {@code rank}.
     */
    private int pair(byte[] raw, int rank)
    {
        int b = raw[significantIndex(rank)] & 0xFF;
        return ((b >>> 4) * 10) + (b & 0x0F);
    }

    private void checkLength(byte[] raw)
    {
        Objects.requireNonNull(raw, "raw");
        if (raw.length != length) {
            throw new IllegalArgumentException("Expected " + length + " bytes, got " + raw.length);
        }
    }

    /*
     * Maps significance rank (0 = most significant pair) to a byte index.
     */
    private int significantIndex(int rank)
    {
        return (order == ByteOrder.BIG_ENDIAN) ? rank : length - 1 - rank;
    }

    @Override
    public String toString()
    {
        return "BcdCodec[" + (order == ByteOrder.BIG_ENDIAN ? "bbcd" : "lbcd") + ", " + length + ']';
    }
}
