package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

public record BinaryNode(BinaryOperator operator, ExpressionNode left, ExpressionNode right, SourceSpan span)
        implements ExpressionNode {
}
