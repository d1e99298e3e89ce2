package org.silverscript.compiler.frontend.irgen.converters;

import org.silverscript.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silverscript.compiler.frontend.irgen.IrGenContext;
import org.silverscript.compiler.frontend.parser.ast.AssignmentNode;
import org.silverscript.debug.VariableSlot;
import org.silverscript.runtime.isa.Opcode;

/**
 * Overwrites a variable's slot with a new value computed on top of the stack.
 * <p>
 * With {@code k} elements between the slot and the new value, the old value is rolled up and
 * dropped, then the {@code k} elements are rolled back over the new value so it ends up in the
 * slot. When the slot sits directly below the new value a single {@code OP_NIP} suffices.
 */
public final class AssignmentNodeConverter implements IAstNodeToIrConverter<AssignmentNode> {

    @Override
    public void convert(AssignmentNode node, IrGenContext ctx) {
        ctx.beginStatement(node.span());
        VariableSlot slot = ctx.lookup(node.name())
                .filter(s -> !s.isConstant())
                .orElseThrow(() -> new IllegalStateException("not an assignable variable: " + node.name()));
        ctx.lower(node.value());
        int between = ctx.stackSize() - 2 - slot.stackIndex();
        if (between == 0) {
            ctx.emit(Opcode.OP_NIP);
            return;
        }
        ctx.emitNumber(between + 1);
        ctx.emit(Opcode.OP_ROLL);
        ctx.emit(Opcode.OP_DROP);
        for (int i = 0; i < between; i++) {
            ctx.emitNumber(between);
            ctx.emit(Opcode.OP_ROLL);
        }
    }
}
