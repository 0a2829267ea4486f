package com.questrail.memmap.binding;

import com.questrail.memmap.codec.EncodingException;
import com.questrail.memmap.layout.ResolvedArray;
import com.questrail.memmap.store.BackingStore;
import com.questrail.memmap.store.OutOfBoundsException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

final class ArrayView extends AbstractView implements BoundArray
{
    private final ResolvedArray array;

    ArrayView(ResolvedArray template, int delta, BackingStore store, byte pad, String path)
    {
        super(template, delta, store, pad, path);
        this.array = template;
    }

    @Override
    public int size()
    {
        return array.count();
    }

    @Override
    public BoundElement element(int index)
    {
        return (BoundElement) view(index);
    }

    private AbstractView view(int index)
    {
        if (index < 0 || index >= array.count()) {
            throw new OutOfBoundsException(String.format(
                    "index %d outside %s[0..%d)", index, describe(), array.count()));
        }
        String elementPath = path() + "[" + index + "]";
        if (array.bitArray()) {
            return new BitfieldView(array.bitAt(index), delta, store, pad, elementPath);
        }
        int shift = array.elementOffset(index) - array.byteOffset();
        return AbstractView.of(array.element(), delta + shift, store, pad, elementPath);
    }

    @Override
    public BoundPrimitive primitive(int index)
    {
        return Bindings.as(element(index), BoundPrimitive.class);
    }

    @Override
    public BoundBitfield bitfield(int index)
    {
        return Bindings.as(element(index), BoundBitfield.class);
    }

    @Override
    public BoundRecord record(int index)
    {
        return Bindings.as(element(index), BoundRecord.class);
    }

    @Override
    public BoundArray array(int index)
    {
        return Bindings.as(element(index), BoundArray.class);
    }

    @Override
    public List<BoundElement> elements()
    {
        List<BoundElement> out = new ArrayList<>(array.count());
        for (int i = 0; i < array.count(); i++) {
            out.add(element(i));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Encodes every value into a scratch copy of the array's bytes, then
     * writes the copy back in one step. Bit array elements share bytes, so
     * each encode sees the result of the previous one.
     */
    @Override
    public void assignAll(List<?> values)
    {
        Objects.requireNonNull(values, "values");
        if (values.size() != array.count()) {
            throw new EncodingException(String.format(
                    "%s has %d elements; got %d values", describe(), array.count(), values.size()));
        }

        final byte[] scratch = getRaw();
        final int base = byteOffset();
        for (int i = 0; i < values.size(); i++) {
            AbstractView el = view(i);
            int off = el.byteOffset() - base;
            byte[] current = new byte[el.byteSize()];
            System.arraycopy(scratch, off, current, 0, current.length);
            byte[] encoded = el.encode(values.get(i), current);
            System.arraycopy(encoded, 0, scratch, off, encoded.length);
        }
        store.setRaw(base, scratch);
    }

    @Override
    public BoundElement at(String path)
    {
        return PathNavigator.navigate(this, path);
    }
}
