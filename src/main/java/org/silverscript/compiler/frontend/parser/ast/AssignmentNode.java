package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * {@code name = value;}
 *
 * @param name The assigned variable.
 * @param value The new value.
 * @param span The statement range.
 */
public record AssignmentNode(String name, ExpressionNode value, SourceSpan span) implements StatementNode {
}
