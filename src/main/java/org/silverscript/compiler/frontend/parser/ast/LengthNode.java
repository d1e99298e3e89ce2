package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * {@code target.length}.
 *
 * @param target The measured value.
 * @param span The source range.
 */
public record LengthNode(ExpressionNode target, SourceSpan span) implements ExpressionNode {
}
