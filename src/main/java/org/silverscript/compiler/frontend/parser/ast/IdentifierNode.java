package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * A reference to a variable or constructor parameter.
 *
 * @param name The referenced name.
 * @param span The source range.
 */
public record IdentifierNode(String name, SourceSpan span) implements ExpressionNode {
}
