package com.questrail.memmap.schema.impl;

/**
 * One lexical token of schema text.
 */
record Token(Type type, String text, int line)
{
    enum Type { IDENT, NUMBER, STRING, PUNCT, EOF }

    boolean is(Type t, String s)
    {
        return type == t && text.equals(s);
    }

    boolean isPunct(char c)
    {
        return type == Type.PUNCT && text.length() == 1 && text.charAt(0) == c;
    }

    String describe()
    {
        return switch (type) {
            case EOF -> "end of schema";
            case STRING -> "string " + text;
            default -> "'" + text + "'";
        };
    }
}
