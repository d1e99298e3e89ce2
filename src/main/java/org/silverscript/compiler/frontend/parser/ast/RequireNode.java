package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * {@code require(condition, "message");}
 *
 * @param condition The condition that must hold.
 * @param message The optional failure message, {@code null} if absent.
 * @param span The statement range.
 */
public record RequireNode(ExpressionNode condition, String message, SourceSpan span) implements StatementNode {
}
