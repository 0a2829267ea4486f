package com.questrail.memmap.codec.impl;

import com.questrail.memmap.codec.EncodingException;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

final class IntegerCodecTest
{
    private static final ByteOrder BE = ByteOrder.BIG_ENDIAN;
    private static final ByteOrder LE = ByteOrder.LITTLE_ENDIAN;

    // ---------------------------------------------------------------------
    // Byte order
    // ---------------------------------------------------------------------

    @Test
    void bigEndianPutsMostSignificantByteFirst() {
        IntegerCodec u16 = new IntegerCodec(2, false, BE);
        assertArrayEquals(new byte[] { 0x12, 0x34 }, u16.encodeLong(0x1234));
        assertEquals(0x1234L, u16.decodeLong(new byte[] { 0x12, 0x34 }));
    }

    @Test
    void littleEndianPutsLeastSignificantByteFirst() {
        IntegerCodec ul16 = new IntegerCodec(2, false, LE);
        assertArrayEquals(new byte[] { 0x34, 0x12 }, ul16.encodeLong(0x1234));
        assertEquals(0x030201L, new IntegerCodec(3, false, LE).decodeLong(new byte[] { 1, 2, 3 }));
    }

    @Test
    void fullUnsigned32BitRangeFitsInLong() {
        IntegerCodec u32 = new IntegerCodec(4, false, BE);
        byte[] ff = { (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF };
        assertArrayEquals(ff, u32.encodeLong(0xFFFFFFFFL));
        assertEquals(0xFFFFFFFFL, u32.decodeLong(ff));
    }

    // ---------------------------------------------------------------------
    // Sign
    // ---------------------------------------------------------------------

    @Test
    void signedDecodeSignExtends() {
        assertEquals(-1L, new IntegerCodec(1, true, BE).decodeLong(new byte[] { (byte) 0xFF }));
        assertEquals(-2L, new IntegerCodec(2, true, BE).decodeLong(new byte[] { (byte) 0xFF, (byte) 0xFE }));
        assertEquals(-8388608L,
                new IntegerCodec(3, true, LE).decodeLong(new byte[] { 0x00, 0x00, (byte) 0x80 }));
    }

    @Test
    void signedEncodeIsTwosComplement() {
        assertArrayEquals(new byte[] { (byte) 0xFF, (byte) 0xFE }, new IntegerCodec(2, true, BE).encodeLong(-2));
        assertArrayEquals(new byte[] { (byte) 0xFE, (byte) 0xFF }, new IntegerCodec(2, true, LE).encodeLong(-2));
    }

    // ---------------------------------------------------------------------
    // Range
    // ---------------------------------------------------------------------

    @Test
    void boundsAreExact() {
        IntegerCodec i8 = new IntegerCodec(1, true, BE);
        assertEquals(-128, i8.min());
        assertEquals(127, i8.max());
        assertDoesNotThrow(() -> i8.encodeLong(-128));
        assertDoesNotThrow(() -> i8.encodeLong(127));
        assertThrows(EncodingException.class, () -> i8.encodeLong(128));
        assertThrows(EncodingException.class, () -> i8.encodeLong(-129));
    }

    @Test
    void outOfRangeIsRejectedNotMasked() {
        IntegerCodec u8 = new IntegerCodec(1, false, BE);
        EncodingException e = assertThrows(EncodingException.class, () -> u8.encodeLong(256));
        assertTrue(e.getMessage().contains("256"));
        assertThrows(EncodingException.class, () -> u8.encodeLong(-1));
        assertThrows(EncodingException.class, () -> new IntegerCodec(4, false, BE).encodeLong(0x1_0000_0000L));
    }

    @Test
    void wrongInputLengthIsAProgrammingError() {
        IntegerCodec u16 = new IntegerCodec(2, false, BE);
        assertThrows(IllegalArgumentException.class, () -> u16.decodeLong(new byte[3]));
        assertThrows(IllegalArgumentException.class, () -> new IntegerCodec(5, false, BE));
    }
}
