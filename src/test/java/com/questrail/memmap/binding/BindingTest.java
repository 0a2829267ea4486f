package com.questrail.memmap.binding;

import com.questrail.memmap.codec.EncodingException;
import com.questrail.memmap.layout.ResolvedLayout;
import com.questrail.memmap.layout.impl.DefaultLayoutResolver;
import com.questrail.memmap.schema.PrimitiveKind;
import com.questrail.memmap.schema.impl.DefaultSchemaCompiler;
import com.questrail.memmap.store.BackingStore;
import com.questrail.memmap.store.OutOfBoundsException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class BindingTest
{
    private static final byte SPACE = 0x20;

    private static ResolvedLayout layout(String text) {
        return new DefaultLayoutResolver().resolve(new DefaultSchemaCompiler().compile(text));
    }

    private static BoundRecord bind(String text, byte... image) {
        return Bindings.bind(layout(text), BackingStore.load(image), SPACE);
    }

    private static byte[] bytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Integers and bitfields
    // ---------------------------------------------------------------------

    @Test
    void integerAndNibbles() {
        BoundRecord root = bind("u8 a; u8 b:4, c:4;", bytes(0x12, 0xAB));
        assertEquals(0x12, root.primitive("a").longValue());
        assertEquals(0xA, root.bitfield("b").value());
        assertEquals(0xB, root.bitfield("c").value());

        root.bitfield("b").assign(0x3);
        assertArrayEquals(bytes(0x12, 0x3B), root.getRaw());
    }

    @Test
    void sixteenBitBitfieldsInBothByteOrders() {
        BoundRecord be = bind("u16 foo:4, bar:8, baz:4;", bytes(0x12, 0x34));
        assertEquals(1, be.bitfield("foo").value());
        assertEquals(0x23, be.bitfield("bar").value());
        assertEquals(4, be.bitfield("baz").value());
        be.bitfield("foo").assign(2);
        be.bitfield("bar").assign(0x11);
        be.bitfield("baz").assign(3);
        assertArrayEquals(bytes(0x21, 0x13), be.getRaw());

        BoundRecord le = bind("ul16 foo:4, bar:8, baz:4;", bytes(0x34, 0x12));
        assertEquals(0x23, le.bitfield("bar").value());
        le.bitfield("foo").assign(2);
        le.bitfield("bar").assign(0x11);
        le.bitfield("baz").assign(3);
        assertArrayEquals(bytes(0x13, 0x21), le.getRaw());
    }

    @Test
    void twentyFourBitBitfields() {
        BoundRecord root = bind("u24 foo:12, bar:6, baz:6;", bytes(0x00, 0x40, 0xC2));
        assertEquals(4, root.bitfield("foo").value());
        assertEquals(3, root.bitfield("bar").value());
        assertEquals(2, root.bitfield("baz").value());
        root.bitfield("foo").assign(1);
        root.bitfield("bar").assign(2);
        root.bitfield("baz").assign(3);
        assertArrayEquals(bytes(0x00, 0x10, 0x83), root.getRaw());

        BoundRecord le = bind("ul24 foo:12, bar:6, baz:6;", bytes(0xC2, 0x40, 0x00));
        le.bitfield("foo").assign(1);
        le.bitfield("bar").assign(2);
        le.bitfield("baz").assign(3);
        assertArrayEquals(bytes(0x83, 0x10, 0x00), le.getRaw());
    }

    @Test
    void bitfieldsAreIndependent() {
        BoundRecord root = bind("u8 lowpower:2, wide:1, unused:5;", bytes(0xFF));
        root.bitfield("wide").assign(false);
        assertEquals(3, root.bitfield("lowpower").value());
        assertEquals(31, root.bitfield("unused").value());
        assertFalse(root.bitfield("wide").isSet());
        assertArrayEquals(bytes(0xDF), root.getRaw());
    }

    @Test
    void signedIntegers() {
        BoundRecord root = bind("i8 a; il16 b;", bytes(0xFF, 0xFE, 0xFF));
        assertEquals(-1, root.primitive("a").longValue());
        assertEquals(-2, root.primitive("b").longValue());
        root.primitive("b").assign(-300);
        assertEquals(-300L, root.primitive("b").value());
    }

    // ---------------------------------------------------------------------
    // Bits
    // ---------------------------------------------------------------------

    @Test
    void bitArrayNumbersFromMostSignificantBit() {
        BoundRecord root = bind("bit foo[24];", bytes(0x00, 0x80, 0x01));
        BoundArray foo = root.array("foo");
        for (int i = 0; i < 24; i++) {
            assertEquals(i == 8 || i == 23, foo.bitfield(i).isSet(), "bit " + i);
        }
        for (int i = 0; i < 24; i++) {
            foo.bitfield(i).assign(i % 2 == 1);
        }
        assertArrayEquals(bytes(0x55, 0x55, 0x55), root.getRaw());
    }

    @Test
    void lbitArrayNumbersFromLeastSignificantBit() {
        BoundRecord root = bind("lbit foo[24];", bytes(0x00, 0x20, 0x80));
        BoundArray foo = root.array("foo");
        for (int i = 0; i < 24; i++) {
            assertEquals(i == 13 || i == 23, foo.bitfield(i).isSet(), "bit " + i);
        }
        for (int i = 0; i < 24; i++) {
            foo.bitfield(i).assign(i % 2 == 1);
        }
        assertArrayEquals(bytes(0xAA, 0xAA, 0xAA), root.getRaw());
    }

    @Test
    void assignAllOnBitArray() {
        BoundRecord root = bind("bit flags[8];", bytes(0x00));
        root.array("flags").assignAll(List.of(true, false, false, false, false, false, false, true));
        assertArrayEquals(bytes(0x81), root.getRaw());
    }

    // ---------------------------------------------------------------------
    // BCD and characters
    // ---------------------------------------------------------------------

    @Test
    void bcdInBothPairOrders() {
        BoundRecord root = bind("bbcd b[2]; lbcd l[2];", bytes(0x12, 0x34, 0x12, 0x34));
        assertEquals(1234, root.primitive("b").longValue());
        assertEquals(3412, root.primitive("l").longValue());

        root.primitive("b").assign(42);
        root.primitive("l").assign(42);
        assertArrayEquals(bytes(0x00, 0x42, 0x42, 0x00), root.getRaw());
    }

    @Test
    void bcdRoundTripAndOverflow() {
        BoundRecord root = bind("bbcd one[1];", bytes(0x00));
        BoundPrimitive one = root.primitive("one");
        one.assign(99);
        assertEquals(99, one.longValue());
        assertThrows(EncodingException.class, () -> one.assign(9999));
        assertArrayEquals(bytes(0x99), root.getRaw());
    }

    @Test
    void bcdAcceptsDigitStrings() {
        BoundRecord root = bind("bbcd code[2];", bytes(0x00, 0x00));
        root.primitive("code").assign("0123");
        assertEquals(123, root.primitive("code").longValue());
        assertThrows(EncodingException.class, () -> root.primitive("code").assign("12x"));
    }

    @Test
    void wideBcdDecodesWithoutOverflow() {
        byte[] image = new byte[10];
        Arrays.fill(image, (byte) 0x99);
        BoundPrimitive big = bind("bbcd big[10];", image).primitive("big");

        assertEquals(new BigInteger("99999999999999999999"), big.value());
        assertEquals("99999999999999999999", big.stringValue());
        assertThrows(EncodingException.class, big::longValue);

        Bindings.assign(big, BigInteger.ONE.shiftLeft(64));
        assertEquals(BigInteger.ONE.shiftLeft(64), Bindings.value(big));
        big.assign(7);
        assertEquals(7L, big.longValue());
    }

    @Test
    void bankMaskOfOneHundredTwentyEightPairs() {
        byte[] image = new byte[128];
        image[3] = 0x01;
        BoundRecord root = bind("struct { bbcd memory[128]; } banks[1];", image);
        BoundPrimitive memory = root.array("banks").record(0).primitive("memory");

        assertEquals(128, memory.length());
        assertEquals(BigInteger.valueOf(100).pow(124), Bindings.value(memory));
        assertEquals(1L, memory.element(3).longValue());
        assertEquals(1, root.at(".banks[0].memory[3]").byteSize());
        assertEquals(".banks[0].memory[3]", root.at("banks[0].memory[3]").path());
    }

    // ---------------------------------------------------------------------
    // Pairs and characters by index
    // ---------------------------------------------------------------------

    @Test
    void bcdPairsAreIndexedInStorageOrder() {
        BoundRecord root = bind("lbcd freq[4];", bytes(0x00, 0x20, 0x65, 0x14));
        BoundPrimitive freq = root.primitive("freq");
        assertEquals(14652000L, freq.longValue());
        assertEquals(4, freq.elements().size());
        assertEquals(20L, freq.element(1).longValue());
        assertEquals(14L, ((BoundPrimitive) root.at("freq[3]")).longValue());

        freq.element(0).assign(50);
        assertArrayEquals(bytes(0x50, 0x20, 0x65, 0x14), root.getRaw());
        assertEquals(14652050L, freq.longValue());

        assertThrows(EncodingException.class, () -> freq.element(0).assign(100));
        assertThrows(OutOfBoundsException.class, () -> freq.element(4));
        assertThrows(OutOfBoundsException.class, () -> freq.element(-1));
    }

    @Test
    void charactersAreIndexed() {
        BoundRecord root = bind("char name[4];", bytes('A', 'B', 'C', 'D'));
        BoundPrimitive name = root.primitive("name");
        assertEquals("C", name.element(2).stringValue());
        assertEquals(".name[1]", name.element(1).path());

        name.element(1).assign("x");
        assertEquals("AxCD", name.stringValue());
        assertThrows(EncodingException.class, () -> name.element(0).assign("xy"));
        assertEquals("AxCD", name.stringValue());
    }

    @Test
    void integersHaveNoElements() {
        BoundRecord root = bind("u16 word;", bytes(0x12, 0x34));
        assertThrows(TypeMismatchException.class, () -> root.primitive("word").element(0));
        assertThrows(TypeMismatchException.class, () -> root.at("word[0]"));
    }

    // ---------------------------------------------------------------------
    // Mask operations
    // ---------------------------------------------------------------------

    @Test
    void masksOnBcdPairs() {
        BoundRecord root = bind("bbcd memory[2];", bytes(0x00, 0x81));
        BoundPrimitive memory = root.primitive("memory");

        memory.element(0).setBits(0x04);
        assertArrayEquals(bytes(0x04, 0x81), root.getRaw());
        assertEquals(0x04, memory.element(0).bits(0x0C));

        memory.element(1).clearBits(0xF0);
        assertArrayEquals(bytes(0x04, 0x01), root.getRaw());
        assertEquals(0, memory.element(1).bits(0x80));
    }

    @Test
    void masksOnIntegersFollowByteOrder() {
        BoundRecord root = bind("u16 be; ul16 le;", bytes(0x00, 0x00, 0x00, 0x00));
        root.primitive("be").setBits(0x0102);
        root.primitive("le").setBits(0x0102);
        assertArrayEquals(bytes(0x01, 0x02, 0x02, 0x01), root.getRaw());

        root.primitive("le").clearBits(0x0100);
        assertEquals(0x0002, root.primitive("le").longValue());
        assertEquals(0x0100, root.primitive("be").bits(0xFF00));
    }

    @Test
    void masksOnSignedIntegersUseRawBits() {
        BoundRecord root = bind("i8 delta;", bytes(0x7F));
        root.primitive("delta").setBits(0x80);
        assertEquals(-1, root.primitive("delta").longValue());
        assertEquals(0x80, root.primitive("delta").bits(0x80));
    }

    @Test
    void rejectedMasksLeaveStoreUntouched() {
        BoundRecord root = bind("u8 flags; char c[2]; bbcd wide[9];", new byte[12]);
        assertThrows(EncodingException.class, () -> root.primitive("flags").setBits(0x100));
        assertThrows(TypeMismatchException.class, () -> root.primitive("c").setBits(1));
        assertThrows(TypeMismatchException.class, () -> root.primitive("wide").clearBits(1));
        assertArrayEquals(new byte[12], root.getRaw());

        root.primitive("wide").element(8).setBits(1);
        assertEquals(1L, root.primitive("wide").longValue());
    }

    @Test
    void characterFields() {
        BoundRecord root = bind("char name[6];", bytes('A', 'B', 'C', 0xFF, 0xFF, 0xFF));
        BoundPrimitive name = root.primitive("name");
        assertEquals(PrimitiveKind.CHAR, name.kind());
        assertEquals("ABCÿÿÿ", name.stringValue());

        name.assign("CQ");
        assertArrayEquals(bytes('C', 'Q', ' ', ' ', ' ', ' '), name.getRaw());

        name.assign("HI", (byte) 0xFF);
        assertArrayEquals(bytes('H', 'I', 0xFF, 0xFF, 0xFF, 0xFF), name.getRaw());

        assertThrows(TypeMismatchException.class, name::longValue);
        assertThrows(TypeMismatchException.class, () -> name.assign(5));
    }

    @Test
    void tooLongStringLeavesStoreUntouched() {
        BoundRecord root = bind("char name[6];", bytes('A', 'B', 'C', 'D', 'E', 'F'));
        assertThrows(EncodingException.class, () -> root.primitive("name").assign("ABCDEFG"));
        assertArrayEquals(bytes('A', 'B', 'C', 'D', 'E', 'F'), root.getRaw());
    }

    // ---------------------------------------------------------------------
    // Records, arrays, unions
    // ---------------------------------------------------------------------

    @Test
    void arrayOfRecordsIsPositional() {
        BoundRecord root = bind("#seekto 0x04; struct { u8 x; } items[4];",
                bytes(0, 0, 0, 0, 10, 11, 12, 13));
        BoundArray items = root.array("items");
        assertEquals(4, items.size());
        for (int i = 0; i < 4; i++) {
            BoundRecord item = items.record(i);
            assertEquals(4 + i, item.byteOffset());
            assertEquals(10 + i, item.primitive("x").longValue());
            assertEquals(".items[" + i + "]", item.path());
        }
        assertThrows(OutOfBoundsException.class, () -> items.element(4));
        assertThrows(OutOfBoundsException.class, () -> items.element(-1));
    }

    @Test
    void integerArrayAssignAll() {
        BoundRecord root = bind("ul16 v[3];", new byte[6]);
        root.array("v").assignAll(List.of(1, 0x0203, 0xFFFF));
        assertArrayEquals(bytes(0x01, 0x00, 0x03, 0x02, 0xFF, 0xFF), root.getRaw());
        List<Object> values = new ArrayList<>();
        for (BoundElement e : root.array("v").elements()) {
            values.add(Bindings.value(e));
        }
        assertEquals(List.of(1L, 0x0203L, 0xFFFFL), values);
    }

    @Test
    void assignAllIsAllOrNothing() {
        BoundRecord root = bind("u8 v[3];", bytes(7, 7, 7));
        BoundArray v = root.array("v");
        assertThrows(EncodingException.class, () -> v.assignAll(List.of(1, 2, 256)));
        assertThrows(EncodingException.class, () -> v.assignAll(List.of(1, 2)));
        assertThrows(TypeMismatchException.class, () -> v.assignAll(List.of(1, 2, "x")));
        assertArrayEquals(bytes(7, 7, 7), root.getRaw());
    }

    @Test
    void unionMembersAlias() {
        BoundRecord root = bind("union { u16 word; struct { u8 hi; u8 lo; } pair; } u;", bytes(0, 0));
        BoundRecord u = root.record("u");
        u.primitive("word").assign(0xBEEF);
        assertEquals(0xBE, u.record("pair").primitive("hi").longValue());
        assertEquals(0xEF, u.record("pair").primitive("lo").longValue());
    }

    @Test
    void recordFieldLookup() {
        BoundRecord root = bind("u8 a; struct { u8 b; } s;", bytes(1, 2));
        assertTrue(root.has("a"));
        assertFalse(root.has("z"));
        assertEquals(List.of("a", "s"), root.fieldNames());
        assertThrows(TypeMismatchException.class, () -> root.field("z"));
        assertThrows(TypeMismatchException.class, () -> root.primitive("s"));
        assertThrows(TypeMismatchException.class, () -> root.record("a"));
    }

    // ---------------------------------------------------------------------
    // Raw access
    // ---------------------------------------------------------------------

    @Test
    void rawAccessAndFill() {
        BoundRecord root = bind("u8 pre; struct { u16 a; u8 b; } s; u8 post;", bytes(1, 2, 3, 4, 5));
        BoundRecord s = root.record("s");
        assertArrayEquals(bytes(2, 3, 4), s.getRaw());

        s.fill((byte) 0xFF);
        assertArrayEquals(bytes(1, 0xFF, 0xFF, 0xFF, 5), root.getRaw());

        s.setRaw(bytes(9, 8, 7));
        assertEquals(0x0908, s.primitive("a").longValue());

        assertThrows(EncodingException.class, () -> s.setRaw(bytes(1, 2)));
        assertArrayEquals(bytes(1, 9, 8, 7, 5), root.getRaw());
    }

    // ---------------------------------------------------------------------
    // Aliasing and facade
    // ---------------------------------------------------------------------

    @Test
    void viewsOverOneStoreSeeEachOther() {
        ResolvedLayout layout = layout("u16 a; u8 b:4, c:4;");
        BackingStore store = BackingStore.allocate(3);
        BoundRecord one = Bindings.bind(layout, store, SPACE);
        BoundRecord two = Bindings.bind(layout, store, SPACE);

        one.primitive("a").assign(0x1234);
        assertEquals(0x1234, two.primitive("a").longValue());
        two.bitfield("c").assign(5);
        assertEquals(5, one.bitfield("c").value());
        assertArrayEquals(bytes(0x12, 0x34, 0x05), store.dump());
    }

    @Test
    void genericFacade() {
        BoundRecord root = bind("u8 n; char s[2]; u8 f:1, rest:7; struct { u8 x; } r;", bytes(0, 0, 0, 0, 0));
        Bindings.assign(root.field("n"), 200);
        Bindings.assign(root.field("s"), "ok");
        Bindings.assign(root.field("f"), true);
        assertEquals(200L, Bindings.value(root.field("n")));
        assertEquals("ok", Bindings.value(root.field("s")));
        assertEquals(1L, Bindings.value(root.field("f")));

        assertThrows(TypeMismatchException.class, () -> Bindings.value(root.field("r")));
        assertThrows(TypeMismatchException.class, () -> Bindings.assign(root.field("r"), 1));
        assertThrows(TypeMismatchException.class, () -> Bindings.assign(root.field("n"), "200"));
        assertThrows(TypeMismatchException.class, () -> Bindings.assign(root.field("n"), 1.5));
    }

    @Test
    void bindRejectsShortStore() {
        ResolvedLayout layout = layout("u32 a;");
        assertThrows(OutOfBoundsException.class, () -> Bindings.bind(layout, BackingStore.allocate(3), SPACE));
    }

    @Test
    void outOfRangeIntegerLeavesStoreUntouched() {
        BoundRecord root = bind("u8 a; u16 b;", bytes(1, 2, 3));
        assertThrows(EncodingException.class, () -> root.primitive("a").assign(256));
        assertThrows(EncodingException.class, () -> root.primitive("b").assign(-1));
        assertArrayEquals(bytes(1, 2, 3), root.getRaw());
    }
}
