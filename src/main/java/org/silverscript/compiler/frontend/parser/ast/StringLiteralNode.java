package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

public record StringLiteralNode(String value, SourceSpan span) implements ExpressionNode {
}
