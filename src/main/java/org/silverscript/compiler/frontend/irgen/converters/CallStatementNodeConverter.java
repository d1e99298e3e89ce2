package org.silverscript.compiler.frontend.irgen.converters;

import org.silverscript.compiler.api.ParamInfo;
import org.silverscript.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silverscript.compiler.frontend.irgen.IrGenContext;
import org.silverscript.compiler.frontend.parser.ast.CallStatementNode;
import org.silverscript.compiler.frontend.parser.ast.ExpressionNode;
import org.silverscript.compiler.frontend.parser.ast.FunctionNode;
import org.silverscript.debug.FrameInfo;
import org.silverscript.runtime.isa.Opcode;

import java.util.List;

/**
 * Inlines a helper call. The arguments are pushed and become the helper's parameters inside a
 * fresh frame; after the body the caller drops them again. A call that lowers to nothing leaves a
 * single {@code OP_NOP} so the statement can still be stepped on.
 */
public final class CallStatementNodeConverter implements IAstNodeToIrConverter<CallStatementNode> {

    @Override
    public void convert(CallStatementNode node, IrGenContext ctx) {
        ctx.beginStatement(node.span());
        int emittedBefore = ctx.emittedCount();
        FunctionNode target = ctx.semantics().functions().get(node.call().name());
        if (target == null) {
            throw new IllegalStateException("unknown function survived analysis: " + node.call().name());
        }
        for (ExpressionNode argument : node.call().arguments()) {
            ctx.lower(argument);
        }
        List<ParamInfo> params = target.params().stream()
                .map(p -> new ParamInfo(p.name(), ctx.semantics().typeOf(p.type())))
                .toList();

        FrameInfo caller = ctx.frame();
        ctx.beginFrame(new FrameInfo(ctx.allocateFrameId(), target.name(), caller.callDepth() + 1,
                caller.frameId(), node.span(), caller.entrypoint()));
        ctx.declareParameters(params);
        ctx.convert(target.body());
        ctx.endFrame();

        if (ctx.emittedCount() == emittedBefore) {
            ctx.beginStatement(node.span());
            ctx.emit(Opcode.OP_NOP);
            return;
        }
        ctx.continueStatement(node.span());
        ctx.emitDrops(params.size());
    }
}
