package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * {@code !operand} or {@code -operand}.
 *
 * @param negate {@code true} for arithmetic negation, {@code false} for logical not.
 * @param operand The operand.
 * @param span The source range.
 */
public record UnaryNode(boolean negate, ExpressionNode operand, SourceSpan span) implements ExpressionNode {
}
