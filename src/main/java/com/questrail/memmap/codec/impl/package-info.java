/**
 * Value Codecs: Concrete Encodings
 * =============================================================================
 *
 * <p>Concrete codecs for every primitive kind the schema language declares:</p>
 * <ul>
 *   <li>{@link com.questrail.memmap.codec.impl.IntegerCodec}: u8..u32, i8..i32, both byte orders</li>
 *   <li>{@link com.questrail.memmap.codec.impl.BcdCodec}: bbcd / lbcd digit pairs</li>
 *   <li>{@link com.questrail.memmap.codec.impl.CharCodec}: fixed-length single-byte strings</li>
 *   <li>{@link com.questrail.memmap.codec.impl.BitfieldCodec}: bitfield members and single bits</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   BackingStore.getRaw(offset, n)
 *        → codec.decode(raw)            (value out)
 *
 *   codec.encode(value)                  (fails here, before any write)
 *        → BackingStore.setRaw(offset, bytes)
 * </pre>
 *
 * <p>Codecs are pure: they never see a store, an offset or a schema. Every
 * failure is an {@link com.questrail.memmap.codec.EncodingException}; nothing
 * is truncated or clamped.</p>
 */
package com.questrail.memmap.codec.impl;
