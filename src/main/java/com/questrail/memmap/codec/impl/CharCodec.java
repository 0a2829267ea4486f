package com.questrail.memmap.codec.impl;

import com.questrail.memmap.codec.EncodingException;
import com.questrail.memmap.codec.ValueCodec;

import java.util.Objects;

/**
 * CharCodec
 * -----------------------------------------------------------------------------
 * Fixed-length single-byte character arrays.
 *
 * <p>Each byte maps straight to the character with the same code point
 * (ISO-8859-1). Device images routinely use bytes such as {@code 0xFF} as
 * terminators or blank markers; those decode to {@code 'ÿ'} and encode back
 * to the same byte, so a decode/encode cycle is byte-exact.</p>
 *
 * <p>Encoding a shorter string pads the tail with a pad byte; a longer string, or
 * one containing a character above {@code U+00FF}, is rejected.</p>
 */
public final class CharCodec implements ValueCodec<String>
{
    private final int length;
    private final byte pad;

    /**
     * @param length number of characters (bytes)
     * @param pad    default pad byte used by {@link #encode(String)}
     */
    public CharCodec(int length, byte pad)
    {
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive: " + length);
        }
        this.length = length;
        this.pad = pad;
    }

    @Override
    public int byteLength()
    {
        return length;
    }

    @Override
    public String decode(byte[] raw)
    {
        Objects.requireNonNull(raw, "raw");
        if (raw.length != length) {
            throw new IllegalArgumentException("Expected " + length + " bytes, got " + raw.length);
        }
        final char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = (char) (raw[i] & 0xFF);
        }
        return new String(chars);
    }

    @Override
    public byte[] encode(String value)
    {
        return encode(value, pad);
    }

    /**
     * Encodes {@code value}, padding with {@code padByte} if it is shorter than
     * the field.
     *
     * @throws EncodingException if {@code value} is longer than the field or
     *         contains a character outside {@code U+0000-U+00FF}
     */
    public byte[] encode(String value, byte padByte)
    {
        Objects.requireNonNull(value, "value");
        if (value.length() > length) {
            throw new EncodingException(String.format(
                    "String of %d characters does not fit a %d-character field",
                    value.length(), length));
        }

        final byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            if (i < value.length()) {
                char c = value.charAt(i);
                if (c > 0xFF) {
                    throw new EncodingException(String.format(
                            "Character U+%04X at position %d is not a single-byte character", (int) c, i));
                }
                out[i] = (byte) c;
            } else {
                out[i] = padByte;
            }
        }
        return out;
    }

    @Override
    public String toString()
    {
        return "CharCodec[" + length + ']';
    }
}
