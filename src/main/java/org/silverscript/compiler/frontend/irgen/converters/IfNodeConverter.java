package org.silverscript.compiler.frontend.irgen.converters;

import org.silverscript.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silverscript.compiler.frontend.irgen.IrGenContext;
import org.silverscript.compiler.frontend.parser.ast.IfNode;
import org.silverscript.runtime.isa.Opcode;

/**
 * Lowers {@code if} to {@code cond OP_IF then [OP_ELSE else] OP_ENDIF}. Both branches leave
 * the stack as they found it, so the modelled depth is restored before the else branch.
 */
public final class IfNodeConverter implements IAstNodeToIrConverter<IfNode> {

    @Override
    public void convert(IfNode node, IrGenContext ctx) {
        ctx.beginStatement(node.span());
        ctx.lower(node.condition());
        ctx.emit(Opcode.OP_IF);
        int depth = ctx.stackSize();
        ctx.convert(node.thenBranch());
        if (node.elseBranch() != null) {
            ctx.continueStatement(node.span());
            ctx.emit(Opcode.OP_ELSE);
            ctx.resetStack(depth);
            ctx.convert(node.elseBranch());
        }
        ctx.continueStatement(node.span());
        ctx.emit(Opcode.OP_ENDIF);
        ctx.resetStack(depth);
    }
}
