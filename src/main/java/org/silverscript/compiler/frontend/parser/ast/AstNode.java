package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 */
public interface AstNode {

    /**
     * @return The source range this node was parsed from.
     */
    SourceSpan span();
}
