package com.questrail.memmap.binding;

/**
 * BoundElement
 * -----------------------------------------------------------------------------
 * A live view of one resolved node over a {@link com.questrail.memmap.store.BackingStore}.
 *
 * <p>Views are cheap and hold no copy of the data: each is a resolved template,
 * a byte delta and a store reference. Reads always decode the current bytes;
 * writes mutate the shared store in place, so every other view over the same
 * bytes observes them immediately.</p>
 *
 * <h2>Failure</h2>
 * Every write validates and encodes completely before touching the store.
 * A rejected write leaves the store byte-for-byte unchanged.
 */
public sealed interface BoundElement permits BoundPrimitive, BoundBitfield, BoundRecord, BoundArray
{
    /**
     * Declared field name; empty for the root record.
     */
    String name();

    /**
     * Path from the root, e.g. {@code .memory[3].rxfreq}; empty for the root.
     */
    String path();

    /**
     * Absolute offset of the first byte covered by this element.
     */
    int byteOffset();

    /**
     * Bytes covered by this element. For bitfields and single bits this is
     * the whole carrier.
     */
    int byteSize();

    /**
     * Returns a copy of the bytes covered by this element.
     */
    byte[] getRaw();

    /**
     * Overwrites the bytes covered by this element.
     *
     * @throws com.questrail.memmap.codec.EncodingException if {@code raw} is
     *         not exactly {@link #byteSize()} bytes long
     */
    void setRaw(byte[] raw);

    /**
     * Sets every byte covered by this element to {@code value}.
     */
    void fill(byte value);
}
