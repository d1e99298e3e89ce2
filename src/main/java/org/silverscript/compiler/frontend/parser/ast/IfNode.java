package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * {@code if (condition) thenBranch else elseBranch}.
 *
 * @param condition The branch condition.
 * @param thenBranch The taken branch.
 * @param elseBranch The alternative, {@code null} if absent. An {@code else if} is a nested {@link IfNode} block.
 * @param span The range of the {@code if} header.
 */
public record IfNode(ExpressionNode condition, BlockNode thenBranch, BlockNode elseBranch, SourceSpan span)
        implements StatementNode {
}
