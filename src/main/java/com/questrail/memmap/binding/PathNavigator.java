package com.questrail.memmap.binding;

import java.util.Objects;

/**
 * Walks dotted, indexed paths such as {@code .settings.squelch} or
 * {@code .memory[3].rxfreq} from a starting element.
 *
 * <p>{@code .name} steps apply to records and {@code [i]} steps to arrays and
 * to the pairs or characters of BCD and character fields. A path may omit the
 * leading dot. The empty path is the starting element.</p>
 */
final class PathNavigator
{
    private PathNavigator() {}

    static BoundElement navigate(BoundElement start, String path)
    {
        Objects.requireNonNull(path, "path");
        BoundElement current = start;
        int i = 0;

        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '[') {
                int close = path.indexOf(']', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed '[' in path '" + path + "'");
                }
                int index = parseIndex(path, path.substring(i + 1, close));
                if (current instanceof BoundArray array) {
                    current = array.element(index);
                } else if (current instanceof BoundPrimitive p && !p.kind().isInteger()) {
                    current = p.element(index);
                } else {
                    throw new TypeMismatchException(describe(current) + " is not an array; cannot apply ["
                            + index + "]");
                }
                i = close + 1;
            } else {
                int nameStart = c == '.' ? i + 1 : i;
                if (c == '.' && i == 0 && path.length() == 1) {
                    break;
                }
                int end = nameStart;
                while (end < path.length() && path.charAt(end) != '.' && path.charAt(end) != '[') {
                    end++;
                }
                String name = path.substring(nameStart, end);
                if (name.isEmpty()) {
                    throw new IllegalArgumentException("Empty field name in path '" + path + "'");
                }
                if (!(current instanceof BoundRecord rec)) {
                    throw new TypeMismatchException(describe(current) + " is not a record; cannot apply ."
                            + name);
                }
                current = rec.field(name);
                i = end;
            }
        }
        return current;
    }

    private static int parseIndex(String path, String text)
    {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad index '" + text + "' in path '" + path + "'", e);
        }
    }

    private static String describe(BoundElement element)
    {
        return element.path().isEmpty() ? "<root>" : element.path();
    }
}
