package com.questrail.memmap.schema;

import java.nio.ByteOrder;
import java.util.Optional;

/**
 * PrimitiveKind
 * -----------------------------------------------------------------------------
 * Every primitive type keyword of the schema language.
 *
 * <h2>Naming</h2>
 * <ul>
 *   <li>{@code u}/{@code i}: unsigned / signed two's-complement integer</li>
 *   <li>an {@code l} after the sign letter: little-endian byte order
 *       ({@code ul16}, {@code il32}); otherwise big-endian</li>
 *   <li>the trailing number: width in bits (8, 16, 24, 32)</li>
 *   <li>{@code bbcd}/{@code lbcd}: BCD digit pairs, most significant pair
 *       first / last</li>
 *   <li>{@code char}: single-byte character</li>
 *   <li>{@code bit}/{@code lbit}: single bits numbered from the most / least
 *       significant bit of each byte; legal only in arrays</li>
 * </ul>
 */
public enum PrimitiveKind
{
    U8("u8", Family.INTEGER, 1, false, ByteOrder.BIG_ENDIAN),
    U16("u16", Family.INTEGER, 2, false, ByteOrder.BIG_ENDIAN),
    UL16("ul16", Family.INTEGER, 2, false, ByteOrder.LITTLE_ENDIAN),
    U24("u24", Family.INTEGER, 3, false, ByteOrder.BIG_ENDIAN),
    UL24("ul24", Family.INTEGER, 3, false, ByteOrder.LITTLE_ENDIAN),
    U32("u32", Family.INTEGER, 4, false, ByteOrder.BIG_ENDIAN),
    UL32("ul32", Family.INTEGER, 4, false, ByteOrder.LITTLE_ENDIAN),
    I8("i8", Family.INTEGER, 1, true, ByteOrder.BIG_ENDIAN),
    I16("i16", Family.INTEGER, 2, true, ByteOrder.BIG_ENDIAN),
    IL16("il16", Family.INTEGER, 2, true, ByteOrder.LITTLE_ENDIAN),
    I24("i24", Family.INTEGER, 3, true, ByteOrder.BIG_ENDIAN),
    IL24("il24", Family.INTEGER, 3, true, ByteOrder.LITTLE_ENDIAN),
    I32("i32", Family.INTEGER, 4, true, ByteOrder.BIG_ENDIAN),
    IL32("il32", Family.INTEGER, 4, true, ByteOrder.LITTLE_ENDIAN),
    CHAR("char", Family.CHARACTER, 1, false, ByteOrder.BIG_ENDIAN),
    BBCD("bbcd", Family.BCD, 1, false, ByteOrder.BIG_ENDIAN),
    LBCD("lbcd", Family.BCD, 1, false, ByteOrder.LITTLE_ENDIAN),
    BIT("bit", Family.BIT, 1, false, ByteOrder.BIG_ENDIAN),
    LBIT("lbit", Family.BIT, 1, false, ByteOrder.LITTLE_ENDIAN);

    /**
     * Broad value category; decides which codec and which bound view serve a
     * field.
     */
    public enum Family { INTEGER, CHARACTER, BCD, BIT }

    private final String keyword;
    private final Family family;
    private final int byteWidth;
    private final boolean signed;
    private final ByteOrder order;

    PrimitiveKind(String keyword, Family family, int byteWidth, boolean signed, ByteOrder order) {
        this.keyword = keyword;
        this.family = family;
        this.byteWidth = byteWidth;
        this.signed = signed;
        this.order = order;
    }

    public String keyword() {
        return keyword;
    }

    public Family family() {
        return family;
    }

    /**
     * Bytes occupied by one unit of this kind. For {@link Family#BIT} kinds this
     * is the byte that carries eight consecutive bits.
     */
    public int byteWidth() {
        return byteWidth;
    }

    public boolean signed() {
        return signed;
    }

    public ByteOrder order() {
        return order;
    }

    public boolean isInteger() {
        return family == Family.INTEGER;
    }

    /**
     * Looks up a kind by its schema keyword.
     */
    public static Optional<PrimitiveKind> forKeyword(String keyword) {
        for (PrimitiveKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
