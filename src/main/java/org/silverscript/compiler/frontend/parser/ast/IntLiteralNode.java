package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

public record IntLiteralNode(long value, SourceSpan span) implements ExpressionNode {
}
