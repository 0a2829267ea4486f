package com.questrail.memmap.binding;

import com.questrail.memmap.codec.EncodingException;
import com.questrail.memmap.layout.ResolvedArray;
import com.questrail.memmap.layout.ResolvedBitfield;
import com.questrail.memmap.layout.ResolvedNode;
import com.questrail.memmap.layout.ResolvedPrimitive;
import com.questrail.memmap.layout.ResolvedRecord;
import com.questrail.memmap.store.BackingStore;

import java.util.Objects;

/**
 * Shared state and raw access of every view: a resolved template node, the
 * byte delta from the template's position to this view's position, and the
 * store.
 */
abstract class AbstractView
{
    final ResolvedNode template;
    final int delta;
    final BackingStore store;
    final byte pad;
    private final String path;

    AbstractView(ResolvedNode template, int delta, BackingStore store, byte pad, String path)
    {
        this.template = Objects.requireNonNull(template, "template");
        this.delta = delta;
        this.store = Objects.requireNonNull(store, "store");
        this.pad = pad;
        this.path = Objects.requireNonNull(path, "path");
    }

    static AbstractView of(ResolvedNode node, int delta, BackingStore store, byte pad, String path)
    {
        if (node instanceof ResolvedPrimitive p) {
            return new PrimitiveView(p, delta, store, pad, path);
        }
        if (node instanceof ResolvedBitfield b) {
            return new BitfieldView(b, delta, store, pad, path);
        }
        if (node instanceof ResolvedRecord r) {
            return new RecordView(r, delta, store, pad, path);
        }
        return new ArrayView((ResolvedArray) node, delta, store, pad, path);
    }

    public String name()
    {
        return template.name();
    }

    public String path()
    {
        return path;
    }

    public int byteOffset()
    {
        return template.byteOffset() + delta;
    }

    public int byteSize()
    {
        return template.byteSize();
    }

    public byte[] getRaw()
    {
        return store.getRaw(byteOffset(), byteSize());
    }

    public void setRaw(byte[] raw)
    {
        Objects.requireNonNull(raw, "raw");
        if (raw.length != byteSize()) {
            throw new EncodingException(String.format(
                    "%s covers %d bytes; got %d", describe(), byteSize(), raw.length));
        }
        store.setRaw(byteOffset(), raw);
    }

    public void fill(byte value)
    {
        store.fill(byteOffset(), byteSize(), new byte[] { value });
    }

    /**
     * Decoded value, for leaf views.
     */
    Object read()
    {
        throw new TypeMismatchException(describe() + " has no single value");
    }

    /**
     * Encodes {@code value} over {@code current}, this view's current bytes,
     * and returns the bytes to write. Never writes.
     */
    byte[] encode(Object value, byte[] current)
    {
        throw new TypeMismatchException(describe() + " cannot be assigned a value");
    }

    /**
     * Encodes and writes in one step.
     */
    final void write(Object value)
    {
        byte[] raw = encode(value, getRaw());
        store.setRaw(byteOffset(), raw);
    }

    String describe()
    {
        return path.isEmpty() ? "<root>" : path;
    }

    static long integral(Object value, String where)
    {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw new TypeMismatchException(where + " expects an integer, not " + typeName(value));
    }

    static String typeName(Object value)
    {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName() + '[' + describe() + " @0x" + Integer.toHexString(byteOffset())
                + ", " + byteSize() + " bytes]";
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        AbstractView other = (AbstractView) o;
        return store == other.store && byteOffset() == other.byteOffset()
                && template.equals(other.template) && path.equals(other.path);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(path, byteOffset(), template);
    }
}
