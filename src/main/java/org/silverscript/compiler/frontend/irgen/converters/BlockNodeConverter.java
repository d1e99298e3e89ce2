package org.silverscript.compiler.frontend.irgen.converters;

import org.silverscript.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silverscript.compiler.frontend.irgen.IrGenContext;
import org.silverscript.compiler.frontend.parser.ast.BlockNode;
import org.silverscript.compiler.frontend.parser.ast.StatementNode;

/**
 * Converts a block and drops the variables declared in it. The drops are attributed to the
 * block itself and still see those variables in scope.
 */
public final class BlockNodeConverter implements IAstNodeToIrConverter<BlockNode> {

    @Override
    public void convert(BlockNode node, IrGenContext ctx) {
        ctx.enterBlock();
        for (StatementNode statement : node.statements()) {
            ctx.convert(statement);
        }
        int locals = ctx.blockVariableCount();
        if (locals > 0) {
            ctx.continueStatement(node.span());
            ctx.emitDrops(locals);
        }
        ctx.leaveBlock();
    }
}
