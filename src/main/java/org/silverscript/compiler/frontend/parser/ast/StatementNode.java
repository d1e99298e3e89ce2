package org.silverscript.compiler.frontend.parser.ast;

/**
 * A statement inside a function body.
 */
public interface StatementNode extends AstNode {
}
