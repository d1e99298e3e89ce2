package org.silverscript.runtime.isa.instructions;

import org.silverscript.runtime.ParsedOpcode;
import org.silverscript.runtime.ScriptExecutionException;
import org.silverscript.runtime.internal.ExecutionContext;
import org.silverscript.runtime.isa.Instruction;
import org.silverscript.runtime.isa.Opcode;

/**
 * Handles branching, verification and early termination.
 * IF/NOTIF/ELSE/ENDIF are executed even inside non-executing branches to keep the
 * condition stack balanced; the engine calls this family for them unconditionally.
 */
public class ControlFlowInstruction extends Instruction {

    @Override
    public void execute(ParsedOpcode op, ExecutionContext context) throws ScriptExecutionException {
        Opcode opcode = require(op);
        switch (opcode) {
            case OP_NOP -> { }
            case OP_IF, OP_NOTIF -> {
                boolean condition = false;
                if (context.conditions().isExecuting()) {
                    condition = context.mainStack().popBool();
                    if (opcode == Opcode.OP_NOTIF) {
                        condition = !condition;
                    }
                }
                context.conditions().open(condition);
            }
            case OP_ELSE -> context.conditions().toggle();
            case OP_ENDIF -> context.conditions().close();
            case OP_VERIFY -> {
                if (!context.mainStack().popBool()) {
                    throw new ScriptExecutionException("OP_VERIFY failed: top stack element is false");
                }
            }
            case OP_RETURN -> throw new ScriptExecutionException("script returned early via OP_RETURN");
            default -> throw unsupported(opcode);
        }
    }
}
