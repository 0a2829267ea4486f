package com.questrail.memmap.schema.impl;

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
import com.questrail.memmap.schema.SchemaCompiler;
import com.questrail.memmap.schema.SchemaSyntaxException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * DefaultSchemaCompiler
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SchemaCompiler}: a single left-to-right
 * recursive-descent pass over the token stream.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   schema     := statement*
 *   statement  := definition | struct | union | directive
 *   definition := TYPE ( NAME '[' COUNT ']' | bitdef (',' bitdef)* | NAME ) ';'
 *   bitdef     := NAME ':' COUNT
 *   struct     := 'struct' NAME block ';'
 *               | 'struct' ( block | NAME ) ( NAME '[' COUNT ']' | NAME ) ';'
 *   union      := 'union' block ( NAME '[' COUNT ']' | NAME ) ';'
 *   block      := '{' statement* '}'
 *   directive  := '#' ( 'seekto' NUMBER | 'seek' NUMBER | 'printoffset' STRING ) ';'
 * </pre>
 *
 * <p>{@code char} and BCD arrays become single primitives whose value is the
 * whole string or number. Other arrays become {@link ArrayNode}s. Named struct
 * types are expanded at each use.</p>
 *
 * <p>Any error aborts the whole compilation with a
 * {@link SchemaSyntaxException}.</p>
 */
public final class DefaultSchemaCompiler implements SchemaCompiler
{
    private final LayoutObservabilitySink sink;

    public DefaultSchemaCompiler()
    {
        this(NullObservabilitySink.INSTANCE);
    }

    public DefaultSchemaCompiler(LayoutObservabilitySink sink)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public CompiledSchema compile(String text)
    {
        Objects.requireNonNull(text, "text");
        final Parser parser = new Parser(SchemaLexer.tokenize(text));
        final List<FieldNode> children = parser.parseStatements(0);
        return new CompiledSchema(text, new RecordNode("", children, false, 1));
    }

    /**
     * Parser state for one compilation. Not reused.
     */
    private final class Parser
    {
        private final List<Token> tokens;
        private final Map<String, List<FieldNode>> structTypes = new HashMap<>();
        private int pos;

        Parser(List<Token> tokens)
        {
            this.tokens = tokens;
        }

        /**
         * Parses statements until end of input (top level, {@code openLine == 0})
         * or until the closing brace of a block opened on {@code openLine}.
         */
        List<FieldNode> parseStatements(int openLine)
        {
            final List<FieldNode> nodes = new ArrayList<>();
            final Set<String> names = new HashSet<>();

            while (true) {
                Token t = peek();
                if (t.type() == Token.Type.EOF) {
                    if (openLine > 0) {
                        throw new SchemaSyntaxException(openLine,
                                "Unterminated block: missing '}' for '{' opened here");
                    }
                    return nodes;
                }
                if (t.isPunct('}')) {
                    if (openLine > 0) {
                        return nodes;
                    }
                    throw new SchemaSyntaxException(t.line(), "Unexpected '}' without matching '{'");
                }

                parseStatement().ifPresent(node -> {
                    declare(names, node);
                    nodes.add(node);
                });
            }
        }

        private Optional<FieldNode> parseStatement()
        {
            final Token t = next();

            if (t.isPunct('#')) {
                return Optional.of(parseDirective(t));
            }
            if (t.is(Token.Type.IDENT, "struct")) {
                return parseStruct(t);
            }
            if (t.is(Token.Type.IDENT, "union")) {
                return Optional.of(parseUnion(t));
            }
            if (t.type() == Token.Type.IDENT) {
                PrimitiveKind kind = PrimitiveKind.forKeyword(t.text())
                        .orElseThrow(() -> new SchemaSyntaxException(t.line(),
                                "Unknown type '" + t.text() + "'"));
                return Optional.of(parseDefinition(kind, t));
            }
            throw new SchemaSyntaxException(t.line(), "Expected a declaration, found " + t.describe());
        }

        // ====================================================================
        // Definitions
        // ====================================================================

        private FieldNode parseDefinition(PrimitiveKind kind, Token typeToken)
        {
            final Token nameToken = expectIdent("field name");
            final int line = typeToken.line();

            if (peek().isPunct('[')) {
                next();
                final int count = parseCount(true);
                expectPunct(']');
                expectPunct(';');
                return arrayOf(kind, nameToken.text(), count, line);
            }

            if (peek().isPunct(':')) {
                return parseBitfield(kind, nameToken, line);
            }

            expectPunct(';');
            if (kind.family() == PrimitiveKind.Family.BIT) {
                throw new SchemaSyntaxException(line,
                        "'" + kind.keyword() + "' needs an array count that is a multiple of 8");
            }
            return new PrimitiveField(nameToken.text(), kind, 1, line);
        }

        private FieldNode arrayOf(PrimitiveKind kind, String name, int count, int line)
        {
            switch (kind.family()) {
                case CHARACTER, BCD:
                    return new PrimitiveField(name, kind, count, line);
                case BIT:
                    if (count % 8 != 0) {
                        throw new SchemaSyntaxException(line, String.format(
                                "'%s %s[%d]': bit array count must be a multiple of 8",
                                kind.keyword(), name, count));
                    }
                    return new ArrayNode(name, new PrimitiveField(name, kind, 1, line), count, line);
                default:
                    return new ArrayNode(name, new PrimitiveField(name, kind, 1, line), count, line);
            }
        }

        private FieldNode parseBitfield(PrimitiveKind carrier, Token firstName, int line)
        {
            if (!carrier.isInteger()) {
                throw new SchemaSyntaxException(line,
                        "Bitfields need an integer carrier type, not '" + carrier.keyword() + "'");
            }

            final List<BitfieldMember> members = new ArrayList<>();
            Token name = firstName;
            while (true) {
                expectPunct(':');
                int width = parseCount(true);
                members.add(new BitfieldMember(name.text(), width, name.line()));
                if (peek().isPunct(',')) {
                    next();
                    name = expectIdent("bitfield name");
                    continue;
                }
                expectPunct(';');
                break;
            }

            final BitfieldGroup group = new BitfieldGroup(carrier, members, line);
            final int total = group.totalBits();
            final int carrierBits = carrier.byteWidth() * 8;

            if (total % 8 != 0) {
                throw new SchemaSyntaxException(line, String.format(
                        "Bitfield widths sum to %d bits, not a whole number of bytes", total));
            }
            if (total > carrierBits) {
                throw new SchemaSyntaxException(line, String.format(
                        "Bitfield widths sum to %d bits, more than the %d bits of '%s'",
                        total, carrierBits, carrier.keyword()));
            }
            if (total < carrierBits) {
                sink.onDiagnostic(new LayoutDiagnosticEvent(
                        LayoutDiagnosticEvent.Kind.TRAILING_BITS, line, -1,
                        String.format("%d trailing bits of '%s' unaccounted for after '%s'",
                                carrierBits - total, carrier.keyword(),
                                members.get(members.size() - 1).name())));
            }
            return group;
        }

        // ====================================================================
        // Records
        // ====================================================================

        private Optional<FieldNode> parseStruct(Token structToken)
        {
            final int line = structToken.line();
            final List<FieldNode> body;

            if (peek().type() == Token.Type.IDENT && peekAt(1).isPunct('{')) {
                // Named type definition: struct name { ... };
                final Token typeName = next();
                final List<FieldNode> definition = parseBlock();
                expectPunct(';');
                if (structTypes.putIfAbsent(typeName.text(), definition) != null) {
                    throw new SchemaSyntaxException(typeName.line(),
                            "Struct type '" + typeName.text() + "' is already defined");
                }
                return Optional.empty();
            }

            if (peek().isPunct('{')) {
                body = parseBlock();
            } else {
                final Token typeName = expectIdent("struct type name or '{'");
                body = structTypes.get(typeName.text());
                if (body == null) {
                    throw new SchemaSyntaxException(typeName.line(),
                            "Unknown struct type '" + typeName.text() + "'");
                }
            }

            return Optional.of(parseRecordDeclarator(body, false, line));
        }

        private FieldNode parseUnion(Token unionToken)
        {
            final int line = unionToken.line();
            final List<FieldNode> body = parseBlock();
            if (body.isEmpty()) {
                throw new SchemaSyntaxException(line, "Empty union");
            }
            return parseRecordDeclarator(body, true, line);
        }

        private FieldNode parseRecordDeclarator(List<FieldNode> body, boolean union, int line)
        {
            final Token name = expectIdent("record name");
            final RecordNode record = new RecordNode(name.text(), body, union, line);

            if (peek().isPunct('[')) {
                next();
                final int count = parseCount(true);
                expectPunct(']');
                expectPunct(';');
                return new ArrayNode(name.text(), record, count, line);
            }
            expectPunct(';');
            return record;
        }

        private List<FieldNode> parseBlock()
        {
            final Token open = expectPunct('{');
            final List<FieldNode> children = parseStatements(open.line());
            expectPunct('}');
            return children;
        }

        // ====================================================================
        // Directives
        // ====================================================================

        private FieldNode parseDirective(Token hash)
        {
            final Token name = expectIdent("directive name");
            final PositionDirective directive = switch (name.text()) {
                case "seekto" -> new PositionDirective(
                        PositionDirective.Kind.SEEK_TO, parseCount(false), "", hash.line());
                case "seek" -> new PositionDirective(
                        PositionDirective.Kind.SKIP, parseCount(true), "", hash.line());
                case "printoffset" -> {
                    final Token label = next();
                    if (label.type() != Token.Type.STRING) {
                        throw new SchemaSyntaxException(label.line(),
                                "#printoffset expects a quoted string, found " + label.describe());
                    }
                    String text = label.text();
                    yield new PositionDirective(PositionDirective.Kind.PRINT_OFFSET, 0,
                            text.substring(1, text.length() - 1), hash.line());
                }
                default -> throw new SchemaSyntaxException(name.line(),
                        "Unknown directive '#" + name.text() + "'");
            };

            expectPunct(';');
            return directive;
        }

        // ====================================================================
        // Helpers
        // ====================================================================

        /**
         * Parses a decimal or {@code 0x} hexadecimal integer.
         *
         * @param positive whether zero is rejected (counts and widths) or
         *                 allowed (directive addresses)
         */
        private int parseCount(boolean positive)
        {
            final Token t = next();
            if (t.type() != Token.Type.NUMBER) {
                throw new SchemaSyntaxException(t.line(), "Expected an integer, found " + t.describe());
            }

            final String text = t.text();
            final long value;
            try {
                if (text.startsWith("0x") || text.startsWith("0X")) {
                    value = Long.parseLong(text.substring(2), 16);
                } else {
                    value = Long.parseLong(text, 10);
                }
            } catch (NumberFormatException e) {
                throw new SchemaSyntaxException(t.line(), "'" + text + "' is not an integer");
            }

            if (value > Integer.MAX_VALUE) {
                throw new SchemaSyntaxException(t.line(), "'" + text + "' is too large");
            }
            if (positive && value < 1) {
                throw new SchemaSyntaxException(t.line(), "Count must be positive, found '" + text + "'");
            }
            return (int) value;
        }

        private void declare(Set<String> names, FieldNode node)
        {
            if (node instanceof BitfieldGroup group) {
                for (BitfieldMember m : group.members()) {
                    declareName(names, m.name(), m.line());
                }
            } else if (node instanceof PrimitiveField f) {
                declareName(names, f.name(), f.line());
            } else if (node instanceof RecordNode r) {
                declareName(names, r.name(), r.line());
            } else if (node instanceof ArrayNode a) {
                declareName(names, a.name(), a.line());
            }
        }

        private void declareName(Set<String> names, String name, int line)
        {
            if (!names.add(name)) {
                throw new SchemaSyntaxException(line, "Duplicate field name '" + name + "'");
            }
        }

        private Token expectIdent(String what)
        {
            final Token t = next();
            if (t.type() != Token.Type.IDENT) {
                throw new SchemaSyntaxException(t.line(), "Expected " + what + ", found " + t.describe());
            }
            return t;
        }

        private Token expectPunct(char c)
        {
            final Token t = next();
            if (!t.isPunct(c)) {
                throw new SchemaSyntaxException(t.line(), "Expected '" + c + "', found " + t.describe());
            }
            return t;
        }

        private Token peek()
        {
            return peekAt(0);
        }

        private Token peekAt(int ahead)
        {
            int idx = Math.min(pos + ahead, tokens.size() - 1);
            return tokens.get(idx);
        }

        private Token next()
        {
            Token t = tokens.get(pos);
            if (t.type() != Token.Type.EOF) {
                pos++;
            }
            return t;
        }
    }
}
