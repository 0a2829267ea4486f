package com.questrail.memmap.codec.impl;

import com.questrail.memmap.codec.EncodingException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.ByteOrder;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

final class BcdCodecTest
{
    private static final ByteOrder BE = ByteOrder.BIG_ENDIAN;
    private static final ByteOrder LE = ByteOrder.LITTLE_ENDIAN;

    private static byte[] filled(int length, int value) {
        byte[] raw = new byte[length];
        Arrays.fill(raw, (byte) value);
        return raw;
    }

    @Test
    void pairOrderFollowsByteOrder() {
        byte[] raw = { 0x12, 0x34 };
        assertEquals(1234L, new BcdCodec(2, BE).decodeLong(raw));
        assertEquals(3412L, new BcdCodec(2, LE).decodeLong(raw));
        assertEquals(BigInteger.valueOf(1234), new BcdCodec(2, BE).decode(raw));
    }

    @Test
    void shortValuesAreZeroPadded() {
        assertArrayEquals(new byte[] { 0x00, 0x42 }, new BcdCodec(2, BE).encodeLong(42L));
        assertArrayEquals(new byte[] { 0x42, 0x00 }, new BcdCodec(2, LE).encodeLong(42L));
    }

    @Test
    void fourPairFrequencyRoundTrips() {
        BcdCodec lbcd = new BcdCodec(4, LE);
        byte[] raw = lbcd.encodeLong(14652000L);
        assertArrayEquals(new byte[] { 0x00, 0x20, 0x65, 0x14 }, raw);
        assertEquals(14652000L, lbcd.decodeLong(raw));
    }

    @Test
    void decodeIsLenientAboutNibblesAboveNine() {
        assertEquals(12754L, new BcdCodec(2, BE).decodeLong(new byte[] { (byte) 0xC7, 0x54 }));
    }

    @Test
    void onePairHoldsTwoDigits() {
        BcdCodec one = new BcdCodec(1, BE);
        assertEquals(2, one.digitCapacity());
        assertArrayEquals(new byte[] { (byte) 0x99 }, one.encodeLong(99L));
        assertThrows(EncodingException.class, () -> one.encodeLong(100L));
        assertThrows(EncodingException.class, () -> one.encodeLong(9999L));
    }

    @Test
    void negativeValuesAreRejected() {
        assertThrows(EncodingException.class, () -> new BcdCodec(2, BE).encodeLong(-1L));
        assertThrows(EncodingException.class, () -> new BcdCodec(2, BE).encode(BigInteger.valueOf(-1)));
    }

    @Test
    void digitStrings() {
        BcdCodec codec = new BcdCodec(2, BE);
        assertArrayEquals(new byte[] { 0x01, 0x23 }, codec.encodeDigits("123"));
        assertArrayEquals(new byte[] { 0x00, 0x07 }, codec.encodeDigits("0007"));
        assertThrows(EncodingException.class, () -> codec.encodeDigits("12a4"));
        assertThrows(EncodingException.class, () -> codec.encodeDigits(""));
        assertThrows(EncodingException.class, () -> codec.encodeDigits("12345"));
    }

    // ---------------------------------------------------------------------
    // Wide fields
    // ---------------------------------------------------------------------

    @Test
    void ninePairsFitALong() {
        BcdCodec nine = new BcdCodec(9, BE);
        assertTrue(nine.fitsLong());
        assertEquals(999_999_999_999_999_999L, nine.decodeLong(filled(9, 0x99)));
        assertEquals(1_650_000_000_000_000_000L + 16_500_000_000_000_000L + 165_000_000_000_000L
                        + 1_650_000_000_000L + 16_500_000_000L + 165_000_000L + 1_650_000L + 16_500L + 165L,
                nine.decodeLong(filled(9, 0xFF)));

        byte[] raw = nine.encodeLong(123_456_789_012_345_678L);
        assertEquals(123_456_789_012_345_678L, nine.decodeLong(raw));
    }

    @Test
    void tenPairsDecodeExactly() {
        BcdCodec ten = new BcdCodec(10, BE);
        assertFalse(ten.fitsLong());
        assertEquals(new BigInteger("99999999999999999999"), ten.decode(filled(10, 0x99)));

        EncodingException e = assertThrows(EncodingException.class, () -> ten.decodeLong(filled(10, 0x99)));
        assertTrue(e.getMessage().contains("99999999999999999999"), e.getMessage());

        assertEquals(1234L, ten.decodeLong(ten.encodeLong(1234L)));
    }

    @Test
    void fullCapacityDigitStringsReadBack() {
        BcdCodec ten = new BcdCodec(10, LE);
        String digits = "12345678901234567890";
        byte[] raw = ten.encodeDigits(digits);
        assertEquals(0x90, raw[0] & 0xFF);
        assertEquals(0x12, raw[9] & 0xFF);
        assertEquals(new BigInteger(digits), ten.decode(raw));
    }

    @Test
    void fieldsAsWideAsDeviceBankMasks() {
        BcdCodec wide = new BcdCodec(128, BE);
        byte[] raw = new byte[128];
        raw[3] = 0x01;
        BigInteger expected = BigInteger.valueOf(100).pow(124);
        assertEquals(expected, wide.decode(raw));
        assertThrows(EncodingException.class, () -> wide.decodeLong(raw));

        BigInteger all = new BigInteger("9".repeat(256));
        assertEquals(all, wide.decode(wide.encode(all)));
        assertThrows(EncodingException.class, () -> wide.encode(all.add(BigInteger.ONE)));
    }
}
