package com.questrail.memmap.store;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.Objects;

/**
 * BackingStore
 * -----------------------------------------------------------------------------
 * Fixed-length, mutable byte storage holding one device memory image.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>The length is fixed at construction; it never grows or shrinks.</li>
 *   <li>Every range operation is bounds-checked before any byte is touched.
 *       A range that would extend past {@link #length()} raises
 *       {@link OutOfBoundsException} and leaves the store unmodified.</li>
 *   <li>The store knows nothing about schemas. It is pure byte storage.</li>
 * </ul>
 *
 * <h2>Aliasing</h2>
 * Any number of bound views may reference the same store. A write through one
 * view is visible through every other view covering the same bytes.
 *
 * <h2>Netty containment rule</h2>
 * The image lives in a fixed-capacity heap {@link ByteBuf}. Netty types MUST NOT
 * escape this class; callers only ever see {@code byte[]} copies.
 *
 * <h2>Thread safety</h2>
 * None. A store is owned by one edit session at a time and callers serialize
 * mutation.
 */
public final class BackingStore
{
    private final ByteBuf buffer;

    private BackingStore(ByteBuf buffer)
    {
        this.buffer = buffer;
    }

    /**
     * Creates a zero-filled store of the given length.
     *
     * @param length image length in bytes (non-negative)
     * @return a new store
     */
    public static BackingStore allocate(int length)
    {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        return new BackingStore(Unpooled.buffer(length, length));
    }

    /**
     * Creates a store holding a copy of {@code image}. The store's length is
     * {@code image.length}; later changes to {@code image} are not observed.
     *
     * @param image raw device image
     * @return a new store
     */
    public static BackingStore load(byte[] image)
    {
        Objects.requireNonNull(image, "image");
        ByteBuf buf = Unpooled.buffer(image.length, image.length);
        buf.setBytes(0, image);
        return new BackingStore(buf);
    }

    /**
     * Returns the fixed length of this store in bytes.
     */
    public int length()
    {
        return buffer.capacity();
    }

    /**
     * Returns a copy of {@code length} bytes starting at {@code offset}.
     *
     * @throws OutOfBoundsException if the range extends past the store
     */
    public byte[] getRaw(int offset, int length)
    {
        checkRange(offset, length);
        byte[] out = new byte[length];
        buffer.getBytes(offset, out);
        return out;
    }

    /**
     * Returns the unsigned value of the byte at {@code offset}.
     *
     * @throws OutOfBoundsException if the offset is outside the store
     */
    public int getUnsignedByte(int offset)
    {
        checkRange(offset, 1);
        return buffer.getUnsignedByte(offset);
    }

    /**
     * Copies {@code data} into the store starting at {@code offset}.
     *
     * @throws OutOfBoundsException if the write would extend past the store;
     *         in that case no byte is written
     */
    public void setRaw(int offset, byte[] data)
    {
        Objects.requireNonNull(data, "data");
        checkRange(offset, data.length);
        buffer.setBytes(offset, data);
    }

    /**
     * Fills {@code length} bytes starting at {@code offset} by repeating
     * {@code pattern}. The last repetition is truncated if {@code length} is
     * not a multiple of the pattern length.
     *
     * @throws OutOfBoundsException if the range extends past the store
     */
    public void fill(int offset, int length, byte[] pattern)
    {
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.length == 0) {
            throw new IllegalArgumentException("pattern must not be empty");
        }
        checkRange(offset, length);
        for (int i = 0; i < length; i++) {
            buffer.setByte(offset + i, pattern[i % pattern.length]);
        }
    }

    /**
     * Returns a copy of the whole image. Its length always equals
     * {@link #length()}.
     */
    public byte[] dump()
    {
        return getRaw(0, length());
    }

    private void checkRange(int offset, int length)
    {
        if (offset < 0 || length < 0 || (long) offset + length > buffer.capacity()) {
            throw new OutOfBoundsException(String.format(
                    "Range [0x%04X, +%d) outside store of %d bytes",
                    offset, length, buffer.capacity()));
        }
    }

    @Override
    public String toString()
    {
        return "BackingStore[length=" + length() + ']';
    }
}
