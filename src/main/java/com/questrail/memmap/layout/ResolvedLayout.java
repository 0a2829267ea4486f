package com.questrail.memmap.layout;

import java.util.Map;
import java.util.Objects;

/**
 * The address table of one schema: where every field lives and how large the
 * whole image is. Independent of any buffer; one layout may be bound to many
 * stores.
 *
 * @param root     the unnamed top-level record
 * @param byteSize extent of the layout in bytes
 */
public record ResolvedLayout(ResolvedRecord root, int byteSize)
{
    public ResolvedLayout {
        Objects.requireNonNull(root, "root");
    }

    /**
     * Renders an offset table, one line per leaf or array, e.g.
     * <pre>
     *   0x0010   4  .memory[16].rxfreq
     * </pre>
     * Array elements beyond the first are not listed.
     */
    public String describe() {
        StringBuilder out = new StringBuilder();
        describe(root, "", out);
        return out.toString();
    }

    private static void describe(ResolvedNode node, String path, StringBuilder out) {
        if (node instanceof ResolvedRecord r) {
            for (Map.Entry<String, ResolvedNode> e : r.children().entrySet()) {
                describe(e.getValue(), path + "." + e.getKey(), out);
            }
        } else if (node instanceof ResolvedArray a) {
            line(out, a.byteOffset(), a.byteSize(), path + "[" + a.count() + "]");
            if (!a.bitArray()) {
                describe(a.element(), path + "[0]", out);
            }
        } else if (node instanceof ResolvedBitfield b) {
            line(out, b.byteOffset(), b.byteSize(),
                    path + " :" + b.bitWidth() + " @bit " + b.bitOffset());
        } else {
            line(out, node.byteOffset(), node.byteSize(), path);
        }
    }

    private static void line(StringBuilder out, int offset, int size, String label) {
        out.append(String.format("0x%04X %4d  %s%n", offset, size, label));
    }
}
