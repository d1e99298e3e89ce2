package org.silverscript.compiler.frontend.irgen;

import org.silverscript.compiler.frontend.parser.ast.AstNode;

/**
 * Fallback converter used when no specific converter is registered. Every statement kind has a
 * converter, so reaching this one means the AST and the registry are out of sync.
 */
public final class DefaultAstNodeToIrConverter implements IAstNodeToIrConverter<AstNode> {

    @Override
    public void convert(AstNode node, IrGenContext ctx) {
        throw new IllegalStateException("IR: No converter registered for node type " + node.getClass().getSimpleName());
    }
}
