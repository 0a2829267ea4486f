package com.questrail.memmap.layout;

import com.questrail.memmap.schema.CompiledSchema;

/**
 * LayoutResolver
 * -----------------------------------------------------------------------------
 * Assigns every node of a compiled field tree its position in the image.
 *
 * <p>The resolver walks the tree once with a byte cursor starting at 0:</p>
 * <ul>
 *   <li>Primitives take the cursor and advance it by their size</li>
 *   <li>Bitfield groups place each member from the most significant bit of
 *       the carrier, then advance by the carrier size</li>
 *   <li>Unions place every child at the same offset</li>
 *   <li>Arrays resolve one element; the rest follow at a fixed stride</li>
 *   <li>{@code #seekto} sets the cursor, {@code #seek} advances it</li>
 * </ul>
 *
 * <p>Resolution is a pure function of the schema: it never touches a buffer
 * and repeated calls produce equal layouts.</p>
 */
public interface LayoutResolver
{
    /**
     * @throws LayoutException if the tree cannot be placed
     */
    ResolvedLayout resolve(CompiledSchema schema);

    /**
     * Resolves and additionally requires the layout to fit an image of
     * {@code declaredSize} bytes.
     *
     * @throws LayoutException if the tree cannot be placed or is larger than
     *         {@code declaredSize}
     */
    default ResolvedLayout resolve(CompiledSchema schema, int declaredSize) {
        ResolvedLayout layout = resolve(schema);
        if (layout.byteSize() > declaredSize) {
            throw new LayoutException("", String.format(
                    "layout needs %d bytes but the image is declared as %d",
                    layout.byteSize(), declaredSize));
        }
        return layout;
    }
}
