package org.silverscript.compiler.frontend.irgen.converters;

import org.silverscript.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silverscript.compiler.frontend.irgen.IrGenContext;
import org.silverscript.compiler.frontend.parser.ast.VariableDeclarationNode;
import org.silverscript.debug.VariableOrigin;

/**
 * Pushes the initializer; the slot it lands in becomes the variable.
 */
public final class VariableDeclarationNodeConverter implements IAstNodeToIrConverter<VariableDeclarationNode> {

    @Override
    public void convert(VariableDeclarationNode node, IrGenContext ctx) {
        ctx.beginStatement(node.span());
        ctx.lower(node.initializer());
        ctx.declareTop(node.name(), VariableOrigin.LOCAL, ctx.semantics().typeOf(node.type()));
    }
}
