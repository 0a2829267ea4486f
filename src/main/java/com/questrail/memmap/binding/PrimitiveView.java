package com.questrail.memmap.binding;

import com.questrail.memmap.codec.EncodingException;
import com.questrail.memmap.codec.impl.BcdCodec;
import com.questrail.memmap.codec.impl.CharCodec;
import com.questrail.memmap.codec.impl.IntegerCodec;
import com.questrail.memmap.layout.ResolvedPrimitive;
import com.questrail.memmap.schema.PrimitiveKind;
import com.questrail.memmap.store.BackingStore;
import com.questrail.memmap.store.OutOfBoundsException;

import java.math.BigInteger;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class PrimitiveView extends AbstractView implements BoundPrimitive
{
    private static final int MASK_BYTES = Long.BYTES;

    private final ResolvedPrimitive primitive;
    private final PrimitiveKind kind;
    private final IntegerCodec integer;
    private final BcdCodec bcd;
    private final CharCodec chars;

    PrimitiveView(ResolvedPrimitive template, int delta, BackingStore store, byte pad, String path)
    {
        super(template, delta, store, pad, path);
        this.primitive = template;
        this.kind = template.kind();
        this.integer = kind.isInteger() ? new IntegerCodec(kind.byteWidth(), kind.signed(), kind.order()) : null;
        this.bcd = kind.family() == PrimitiveKind.Family.BCD ? new BcdCodec(template.length(), kind.order()) : null;
        this.chars = kind.family() == PrimitiveKind.Family.CHARACTER ? new CharCodec(template.length(), pad) : null;
    }

    @Override
    public PrimitiveKind kind()
    {
        return kind;
    }

    @Override
    public int length()
    {
        return primitive.length();
    }

    @Override
    public Object value()
    {
        return read();
    }

    @Override
    Object read()
    {
        byte[] raw = getRaw();
        if (integer != null) {
            return integer.decodeLong(raw);
        }
        if (bcd != null) {
            return bcd.fitsLong() ? (Object) bcd.decodeLong(raw) : bcd.decode(raw);
        }
        return chars.decode(raw);
    }

    @Override
    public long longValue()
    {
        if (chars != null) {
            throw new TypeMismatchException(describe() + " is a character field");
        }
        byte[] raw = getRaw();
        return integer != null ? integer.decodeLong(raw) : bcd.decodeLong(raw);
    }

    @Override
    public String stringValue()
    {
        return String.valueOf(read());
    }

    @Override
    public void assign(long value)
    {
        write(value);
    }

    @Override
    public void assign(String value)
    {
        write(value);
    }

    @Override
    public void assign(String value, byte padByte)
    {
        if (chars == null) {
            throw new TypeMismatchException(describe() + " is not a character field");
        }
        store.setRaw(byteOffset(), chars.encode(value, padByte));
    }

    @Override
    public BoundPrimitive element(int index)
    {
        if (integer != null) {
            throw new TypeMismatchException(describe() + " is a " + kind.keyword() + " field and has no elements");
        }
        if (index < 0 || index >= primitive.length()) {
            throw new OutOfBoundsException(String.format(
                    "index %d outside %s[0..%d)", index, describe(), primitive.length()));
        }
        ResolvedPrimitive unit = new ResolvedPrimitive(primitive.name(), kind, 1,
                primitive.byteOffset() + index * kind.byteWidth());
        return new PrimitiveView(unit, delta, store, pad, path() + "[" + index + "]");
    }

    @Override
    public List<BoundPrimitive> elements()
    {
        List<BoundPrimitive> out = new ArrayList<>(primitive.length());
        for (int i = 0; i < primitive.length(); i++) {
            out.add(element(i));
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public long bits(long mask)
    {
        byte[] raw = maskable(mask);
        return rawBits(raw) & mask;
    }

    @Override
    public void setBits(long mask)
    {
        byte[] raw = maskable(mask);
        store.setRaw(byteOffset(), toRaw(rawBits(raw) | mask, raw.length));
    }

    @Override
    public void clearBits(long mask)
    {
        byte[] raw = maskable(mask);
        store.setRaw(byteOffset(), toRaw(rawBits(raw) & ~mask, raw.length));
    }

    /*
     * Current bytes of a field that mask operations apply to, after checking
     * that the mask lies inside it.
     */
    private byte[] maskable(long mask)
    {
        if (chars != null) {
            throw new TypeMismatchException(describe() + " is a character field; mask operations need a number");
        }
        if (byteSize() > MASK_BYTES) {
            throw new TypeMismatchException(String.format(
                    "%s covers %d bytes; mask operations apply to at most %d, index a pair first",
                    describe(), byteSize(), MASK_BYTES));
        }
        int bits = byteSize() * 8;
        if (bits < Long.SIZE && (mask >>> bits) != 0) {
            throw new EncodingException(String.format(
                    "mask 0x%X is wider than the %d bits of %s", mask, bits, describe()));
        }
        return getRaw();
    }

    private long rawBits(byte[] raw)
    {
        long value = 0;
        for (int i = 0; i < raw.length; i++) {
            int idx = kind.order() == ByteOrder.BIG_ENDIAN ? i : raw.length - 1 - i;
            value = (value << 8) | (raw[idx] & 0xFF);
        }
        return value;
    }

    private byte[] toRaw(long bits, int length)
    {
        byte[] out = new byte[length];
        long v = bits;
        for (int i = 0; i < length; i++) {
            int idx = kind.order() == ByteOrder.BIG_ENDIAN ? length - 1 - i : i;
            out[idx] = (byte) (v & 0xFF);
            v >>>= 8;
        }
        return out;
    }

    @Override
    byte[] encode(Object value, byte[] current)
    {
        if (value instanceof String s) {
            if (chars != null) {
                return chars.encode(s);
            }
            if (bcd != null) {
                return bcd.encodeDigits(s);
            }
            throw new TypeMismatchException(describe() + " is a " + kind.keyword() + " field, not a string");
        }
        if (chars != null) {
            throw new TypeMismatchException(describe() + " is a character field; got " + typeName(value));
        }
        if (bcd != null && value instanceof BigInteger big) {
            return bcd.encode(big);
        }
        long v = integral(value, describe());
        return integer != null ? integer.encodeLong(v) : bcd.encodeLong(v);
    }
}
