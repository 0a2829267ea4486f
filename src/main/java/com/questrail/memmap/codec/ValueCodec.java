package com.questrail.memmap.codec;

/**
 * ValueCodec
 * -----------------------------------------------------------------------------
 * Pure mapping between a fixed-length raw byte region and a semantic value.
 *
 * <p>A codec is responsible only for:</p>
 * <ul>
 *   <li>Interpreting exactly {@link #byteLength()} bytes as a value</li>
 *   <li>Producing exactly {@link #byteLength()} bytes for a value</li>
 *   <li>Rejecting values it cannot represent</li>
 * </ul>
 *
 * <p>A codec is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Locating the region inside a store</li>
 *   <li>Writing bytes anywhere</li>
 *   <li>Truncating, wrapping or clamping out-of-range values</li>
 * </ul>
 *
 * @param <V> semantic value type
 */
public interface ValueCodec<V>
{
    /**
     * Number of raw bytes this codec reads and produces.
     */
    int byteLength();

    /**
     * Interprets a raw region.
     *
     * @param raw exactly {@link #byteLength()} bytes
     * @return the decoded value, never {@code null}
     * @throws IllegalArgumentException if {@code raw} has the wrong length
     */
    V decode(byte[] raw);

    /**
     * Produces the raw region for a value.
     *
     * @param value value to encode (must not be {@code null})
     * @return a fresh array of exactly {@link #byteLength()} bytes
     * @throws EncodingException if the value is not representable
     */
    byte[] encode(V value);
}
