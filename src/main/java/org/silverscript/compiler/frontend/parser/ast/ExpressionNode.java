package org.silverscript.compiler.frontend.parser.ast;

/**
 * An expression producing exactly one stack value.
 */
public interface ExpressionNode extends AstNode {
}
