package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * A type reference as written in source, e.g. {@code bytes32} or {@code int[]}.
 *
 * @param name The base type name.
 * @param array {@code true} if followed by {@code []}.
 * @param span The source range.
 */
public record TypeNode(String name, boolean array, SourceSpan span) implements AstNode {

    /**
     * @return The full type name including the array suffix.
     */
    public String text() {
        return array ? name + "[]" : name;
    }
}
