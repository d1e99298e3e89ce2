package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

public record BoolLiteralNode(boolean value, SourceSpan span) implements ExpressionNode {
}
