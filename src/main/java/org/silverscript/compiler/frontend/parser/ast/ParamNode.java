package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * A constructor or function parameter.
 *
 * @param type The declared type.
 * @param name The parameter name.
 * @param span The source range.
 */
public record ParamNode(TypeNode type, String name, SourceSpan span) implements AstNode {
}
