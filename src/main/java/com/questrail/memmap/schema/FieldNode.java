package com.questrail.memmap.schema;

/**
 * Node of a compiled schema's field tree.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link PrimitiveField}: a value-bearing field (integer, BCD, characters, bit)</li>
 *   <li>{@link BitfieldGroup}: named sub-byte fields sharing one integer carrier</li>
 *   <li>{@link RecordNode}: ordered named children (struct), or overlaid children (union)</li>
 *   <li>{@link ArrayNode}: one element node repeated a fixed number of times</li>
 *   <li>{@link PositionDirective}: cursor movement or diagnostic; not a field</li>
 * </ul>
 *
 * <p>Field trees are immutable and carry no offsets. Placement is the job of
 * the layout resolver; a tree may therefore be built programmatically as well
 * as compiled from text.</p>
 */
public sealed interface FieldNode
        permits PrimitiveField, BitfieldGroup, RecordNode, ArrayNode, PositionDirective {

    /**
     * 1-based schema source line that declared this node, or 0 for nodes built
     * programmatically.
     */
    int line();
}
