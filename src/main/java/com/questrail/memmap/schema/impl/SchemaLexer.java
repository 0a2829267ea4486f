package com.questrail.memmap.schema.impl;

import com.questrail.memmap.schema.SchemaSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * SchemaLexer
 * -----------------------------------------------------------------------------
 * Splits schema text into {@link Token}s.
 *
 * <p>{@code //} comments are stripped line by line before tokenizing. Tokens
 * are:</p>
 * <ul>
 *   <li>identifiers: a letter or underscore followed by word characters</li>
 *   <li>numbers: a digit followed by word characters; validated by the parser</li>
 *   <li>strings: double-quoted, single line</li>
 *   <li>punctuation: one of <code>{ } [ ] ; : , #</code></li>
 * </ul>
 *
 * <p>The list always ends with an {@link Token.Type#EOF} token.</p>
 */
final class SchemaLexer
{
    private static final String PUNCTUATION = "{}[];:,#";

    private SchemaLexer() {}

    static List<Token> tokenize(String text)
    {
        final List<Token> tokens = new ArrayList<>();
        final String[] lines = text.split("\n", -1);

        int lastLine = 1;
        for (int l = 0; l < lines.length; l++) {
            final int lineNo = l + 1;
            String line = lines[l];
            int comment = line.indexOf("//");
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            lexLine(line, lineNo, tokens);
            lastLine = lineNo;
        }

        tokens.add(new Token(Token.Type.EOF, "", lastLine));
        return tokens;
    }

    private static void lexLine(String line, int lineNo, List<Token> out)
    {
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (PUNCTUATION.indexOf(c) >= 0) {
                out.add(new Token(Token.Type.PUNCT, String.valueOf(c), lineNo));
                i++;
                continue;
            }

            if (c == '"') {
                int end = line.indexOf('"', i + 1);
                if (end < 0) {
                    throw new SchemaSyntaxException(lineNo, "Unterminated string literal");
                }
                out.add(new Token(Token.Type.STRING, line.substring(i, end + 1), lineNo));
                i = end + 1;
                continue;
            }

            if (isWordChar(c)) {
                int start = i;
                while (i < line.length() && isWordChar(line.charAt(i))) {
                    i++;
                }
                String word = line.substring(start, i);
                Token.Type type = Character.isDigit(c) ? Token.Type.NUMBER : Token.Type.IDENT;
                out.add(new Token(type, word, lineNo));
                continue;
            }

            throw new SchemaSyntaxException(lineNo, "Unexpected character '" + c + "'");
        }
    }

    private static boolean isWordChar(char c)
    {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
