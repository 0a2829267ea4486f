package com.questrail.memmap.binding;

import com.questrail.memmap.codec.impl.BitfieldCodec;
import com.questrail.memmap.layout.ResolvedBitfield;
import com.questrail.memmap.store.BackingStore;

final class BitfieldView extends AbstractView implements BoundBitfield
{
    private final BitfieldCodec codec;

    BitfieldView(ResolvedBitfield template, int delta, BackingStore store, byte pad, String path)
    {
        super(template, delta, store, pad, path);
        this.codec = new BitfieldCodec(template.byteSize(), template.carrier().order(),
                template.bitOffset(), template.bitWidth());
    }

    @Override
    public int bitWidth()
    {
        return codec.width();
    }

    @Override
    public long value()
    {
        return codec.decode(getRaw());
    }

    @Override
    Object read()
    {
        return value();
    }

    @Override
    public boolean isSet()
    {
        return value() != 0;
    }

    @Override
    public void assign(long value)
    {
        write(value);
    }

    @Override
    public void assign(boolean value)
    {
        write(value);
    }

    @Override
    byte[] encode(Object value, byte[] current)
    {
        long v = value instanceof Boolean b ? (b ? 1 : 0) : integral(value, describe());
        return codec.encode(v, current);
    }
}
