package com.questrail.memmap.layout.impl;

import com.questrail.memmap.layout.LayoutException;
import com.questrail.memmap.layout.LayoutResolver;
import com.questrail.memmap.layout.ResolvedArray;
import com.questrail.memmap.layout.ResolvedBitfield;
import com.questrail.memmap.layout.ResolvedLayout;
import com.questrail.memmap.layout.ResolvedNode;
import com.questrail.memmap.layout.ResolvedPrimitive;
import com.questrail.memmap.layout.ResolvedRecord;
import com.questrail.memmap.observability.LayoutDiagnosticEvent;
import com.questrail.memmap.observability.LayoutObservabilitySink;
import com.questrail.memmap.observability.NullObservabilitySink;
import com.questrail.memmap.schema.ArrayNode;
import com.questrail.memmap.schema.BitfieldGroup;
import com.questrail.memmap.schema.BitfieldGroup.BitfieldMember;
import com.questrail.memmap.schema.CompiledSchema;
import com.questrail.memmap.schema.FieldNode;
import com.questrail.memmap.schema.PositionDirective;
import com.questrail.memmap.schema.PrimitiveField;
import com.questrail.memmap.schema.PrimitiveKind;
import com.questrail.memmap.schema.RecordNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultLayoutResolver
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link LayoutResolver}.
 *
 * <h2>Records</h2>
 * A record's size is its high-water mark: the furthest byte reached by any
 * child, measured from the record's start. A backward {@code #seekto} can
 * therefore overlay earlier fields without shrinking the record.
 *
 * <h2>Seeks</h2>
 * A {@code #seekto} to the current offset is reported as
 * {@link LayoutDiagnosticEvent.Kind#REDUNDANT_SEEK}, one to a lower offset as
 * {@link LayoutDiagnosticEvent.Kind#BACKWARD_SEEK}. With
 * {@code rejectBackwardSeeks} both become {@link LayoutException}s.
 * An absolute seek inside an array element is always rejected: every element
 * would land on the same bytes.
 *
 * <h2>Thread safety</h2>
 * Stateless between calls; one instance may be shared.
 */
public final class DefaultLayoutResolver implements LayoutResolver
{
    private final LayoutObservabilitySink sink;
    private final boolean rejectBackwardSeeks;

    public DefaultLayoutResolver()
    {
        this(NullObservabilitySink.INSTANCE, false);
    }

    public DefaultLayoutResolver(LayoutObservabilitySink sink, boolean rejectBackwardSeeks)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.rejectBackwardSeeks = rejectBackwardSeeks;
    }

    @Override
    public ResolvedLayout resolve(CompiledSchema schema)
    {
        Objects.requireNonNull(schema, "schema");
        final ResolvedRecord root = new Walk().record(schema.root(), "");
        return new ResolvedLayout(root, root.byteSize());
    }

    /**
     * Cursor state for one resolution.
     */
    private final class Walk
    {
        private long cursor;
        private int arrayDepth;

        ResolvedRecord record(RecordNode node, String path)
        {
            final long start = cursor;
            long highWater = start;
            Long unionSize = null;
            final Map<String, ResolvedNode> children = new LinkedHashMap<>();

            for (FieldNode child : node.children()) {
                if (node.union()) {
                    if (child instanceof PositionDirective) {
                        throw new LayoutException(path, "directives are not allowed inside a union");
                    }
                    cursor = start;
                }

                String name;
                if (child instanceof PositionDirective d) {
                    directive(d, path);
                    name = null;
                } else if (child instanceof BitfieldGroup g) {
                    ResolvedBitfield[] members = bitfields(g, path);
                    for (ResolvedBitfield b : members) {
                        put(children, b, path);
                    }
                    name = members[0].name();
                } else {
                    ResolvedNode resolved = field(child, path);
                    put(children, resolved, path);
                    name = resolved.name();
                }

                if (node.union() && name != null) {
                    long size = cursor - start;
                    if (unionSize == null) {
                        unionSize = size;
                    } else if (unionSize.longValue() != size) {
                        throw new LayoutException(path + "." + name, String.format(
                                "union member is %d bytes but earlier members are %d",
                                size, unionSize));
                    }
                }
                highWater = Math.max(highWater, cursor);
            }

            if (node.union() && children.isEmpty()) {
                throw new LayoutException(path, "union has no members");
            }

            final int size = toInt(highWater - start, path);
            if (node.union()) {
                cursor = start + size;
            }
            return new ResolvedRecord(node.name(), node.union(), toInt(start, path), size, children);
        }

        private ResolvedNode field(FieldNode node, String parent)
        {
            if (node instanceof PrimitiveField p) {
                return node(p, parent + "." + p.name());
            }
            if (node instanceof RecordNode r) {
                return node(r, parent + "." + r.name());
            }
            if (node instanceof ArrayNode a) {
                return node(a, parent + "." + a.name());
            }
            throw new LayoutException(parent, "unexpected node " + node);
        }

        private ResolvedNode node(FieldNode node, String path)
        {
            if (node instanceof PrimitiveField p) {
                return primitive(p, path);
            }
            if (node instanceof RecordNode r) {
                return record(r, path);
            }
            if (node instanceof ArrayNode a) {
                return array(a, path);
            }
            throw new LayoutException(path, "unexpected node " + node);
        }

        private ResolvedPrimitive primitive(PrimitiveField p, String path)
        {
            if (p.kind().family() == PrimitiveKind.Family.BIT) {
                throw new LayoutException(path, "a single '" + p.kind().keyword() + "' must be declared as an array");
            }
            final ResolvedPrimitive resolved = new ResolvedPrimitive(p.name(), p.kind(), p.length(), toInt(cursor, path));
            advance(resolved.byteSize(), path);
            return resolved;
        }

        private ResolvedBitfield[] bitfields(BitfieldGroup g, String parent)
        {
            final PrimitiveKind carrier = g.carrier();
            final String path = parent + "." + g.members().get(0).name();
            if (!carrier.isInteger()) {
                throw new LayoutException(path, "bitfields need an integer carrier, not '" + carrier.keyword() + "'");
            }
            final int carrierBits = carrier.byteWidth() * 8;
            final int total = g.totalBits();
            if (total % 8 != 0) {
                throw new LayoutException(path, String.format(
                        "bitfield widths sum to %d bits, not a whole number of bytes", total));
            }
            if (total > carrierBits) {
                throw new LayoutException(path, String.format(
                        "bitfield widths sum to %d bits, more than the %d bits of '%s'",
                        total, carrierBits, carrier.keyword()));
            }

            final int offset = toInt(cursor, path);
            final ResolvedBitfield[] out = new ResolvedBitfield[g.members().size()];
            int bit = 0;
            for (int i = 0; i < out.length; i++) {
                BitfieldMember m = g.members().get(i);
                out[i] = new ResolvedBitfield(m.name(), carrier, offset, bit, m.width());
                bit += m.width();
            }
            advance(carrier.byteWidth(), path);
            return out;
        }

        private ResolvedArray array(ArrayNode a, String path)
        {
            final int base = toInt(cursor, path);
            final FieldNode element = a.element();

            if (element instanceof PrimitiveField p && p.kind().family() == PrimitiveKind.Family.BIT) {
                if (a.count() % 8 != 0) {
                    throw new LayoutException(path, String.format(
                            "bit array count %d is not a multiple of 8", a.count()));
                }
                final int firstBit = p.kind() == PrimitiveKind.LBIT ? 7 : 0;
                final ResolvedBitfield bit0 = new ResolvedBitfield(a.name(), p.kind(), base, firstBit, 1);
                advance(a.count() / 8, path);
                return new ResolvedArray(a.name(), base, a.count(), 0, bit0);
            }
            if (element instanceof BitfieldGroup) {
                throw new LayoutException(path, "a bitfield group cannot be an array element");
            }

            arrayDepth++;
            final ResolvedNode first;
            try {
                first = renamed(node(element, path + "[]"), a.name());
            } finally {
                arrayDepth--;
            }

            final long stride = first.byteSize();
            if (stride <= 0) {
                throw new LayoutException(path, "array element occupies no bytes");
            }
            cursor = base;
            advance(stride * a.count(), path);
            return new ResolvedArray(a.name(), base, a.count(), toInt(stride, path), first);
        }

        private void directive(PositionDirective d, String path)
        {
            switch (d.kind()) {
                case SEEK_TO -> {
                    if (arrayDepth > 0) {
                        throw new LayoutException(path, String.format(
                                "#seekto 0x%X inside an array element (line %d)", d.value(), d.line()));
                    }
                    if (d.value() <= cursor) {
                        seekDiagnostic(d, path);
                    }
                    cursor = d.value();
                    toInt(cursor, path);
                }
                case SKIP -> advance(d.value(), path);
                case PRINT_OFFSET -> sink.onDiagnostic(new LayoutDiagnosticEvent(
                        LayoutDiagnosticEvent.Kind.PRINT_OFFSET, d.line(), (int) cursor,
                        String.format("%s: %d (0x%08X)", d.label(), cursor, cursor)));
            }
        }

        private void seekDiagnostic(PositionDirective d, String path)
        {
            final boolean redundant = d.value() == cursor;
            final String message = redundant
                    ? String.format("#seekto 0x%X is the current offset", d.value())
                    : String.format("#seekto 0x%X moves back from 0x%X", d.value(), cursor);
            if (rejectBackwardSeeks) {
                throw new LayoutException(path, message + " (line " + d.line() + ")");
            }
            sink.onDiagnostic(new LayoutDiagnosticEvent(
                    redundant ? LayoutDiagnosticEvent.Kind.REDUNDANT_SEEK : LayoutDiagnosticEvent.Kind.BACKWARD_SEEK,
                    d.line(), (int) cursor, message));
        }

        private void advance(long bytes, String path)
        {
            cursor += bytes;
            toInt(cursor, path);
        }

        private void put(Map<String, ResolvedNode> children, ResolvedNode node, String path)
        {
            if (children.putIfAbsent(node.name(), node) != null) {
                throw new LayoutException(path, "duplicate field name '" + node.name() + "'");
            }
        }

        private int toInt(long value, String path)
        {
            if (value > Integer.MAX_VALUE) {
                throw new LayoutException(path, "offset " + value + " exceeds the addressable range");
            }
            return (int) value;
        }
    }

    /**
     * Array elements carry the array's name so that element views report it.
     */
    private static ResolvedNode renamed(ResolvedNode node, String name)
    {
        if (node.name().equals(name)) {
            return node;
        }
        if (node instanceof ResolvedRecord r) {
            return new ResolvedRecord(name, r.union(), r.byteOffset(), r.byteSize(), r.children());
        }
        if (node instanceof ResolvedArray a) {
            return new ResolvedArray(name, a.byteOffset(), a.count(), a.elementSize(), a.element());
        }
        return node;
    }
}
