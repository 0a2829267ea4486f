package com.questrail.memmap.schema;

/**
 * SchemaCompiler
 * -----------------------------------------------------------------------------
 * Turns schema text into a {@link CompiledSchema}.
 *
 * <p>The compiler is responsible only for:</p>
 * <ul>
 *   <li>Stripping {@code //} comments and tokenizing</li>
 *   <li>Checking structural well-formedness</li>
 *   <li>Building the field tree</li>
 * </ul>
 *
 * <p>The compiler is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Assigning offsets (see the layout resolver)</li>
 *   <li>Touching any buffer</li>
 *   <li>Caching its output</li>
 * </ul>
 *
 * <p>Compilation is a pure function of the text.</p>
 */
public interface SchemaCompiler
{
    /**
     * Compiles schema text.
     *
     * @param text schema source
     * @return the compiled schema
     * @throws SchemaSyntaxException if the text is malformed
     */
    CompiledSchema compile(String text);
}
