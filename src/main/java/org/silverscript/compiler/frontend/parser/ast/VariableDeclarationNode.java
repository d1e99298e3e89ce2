package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * {@code type name = initializer;}
 *
 * @param type The declared type.
 * @param name The variable name.
 * @param initializer The initial value.
 * @param span The statement range.
 */
public record VariableDeclarationNode(TypeNode type, String name, ExpressionNode initializer, SourceSpan span)
        implements StatementNode {
}
