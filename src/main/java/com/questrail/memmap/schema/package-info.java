/**
 * Schema Language: Field Tree
 * =============================================================================
 *
 * <p>The field tree produced by a {@link com.questrail.memmap.schema.SchemaCompiler}:
 * primitives, bitfield groups, records (structs and unions), arrays and
 * position directives. Nodes carry no offsets; see the layout package.</p>
 *
 * <p>Example schema:</p>
 * <pre>
 *   #seekto 0x0008;
 *   struct {
 *     lbcd rxfreq[4];
 *     ul16 rxtone;
 *     u8 unknown:6,
 *        lowpower:2;
 *     char name[7];
 *   } memory[128];
 * </pre>
 */
package com.questrail.memmap.schema;
