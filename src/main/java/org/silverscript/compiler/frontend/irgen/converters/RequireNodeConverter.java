package org.silverscript.compiler.frontend.irgen.converters;

import org.silverscript.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silverscript.compiler.frontend.irgen.IrGenContext;
import org.silverscript.compiler.frontend.parser.ast.RequireNode;
import org.silverscript.runtime.isa.Opcode;

/**
 * {@code require(c)} lowers to {@code c OP_VERIFY}. The message is not part of the bytecode.
 */
public final class RequireNodeConverter implements IAstNodeToIrConverter<RequireNode> {

    @Override
    public void convert(RequireNode node, IrGenContext ctx) {
        ctx.beginStatement(node.span());
        ctx.lower(node.condition());
        ctx.emit(Opcode.OP_VERIFY);
    }
}
