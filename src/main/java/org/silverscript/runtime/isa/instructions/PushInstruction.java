package org.silverscript.runtime.isa.instructions;

import org.silverscript.runtime.ParsedOpcode;
import org.silverscript.runtime.ScriptExecutionException;
import org.silverscript.runtime.internal.ExecutionContext;
import org.silverscript.runtime.isa.Instruction;
import org.silverscript.runtime.isa.Opcode;

/**
 * Handles data pushes and the small-integer opcodes.
 */
public class PushInstruction extends Instruction {

    @Override
    public void execute(ParsedOpcode op, ExecutionContext context) throws ScriptExecutionException {
        if (Opcode.isDirectPush(op.code())) {
            context.mainStack().push(op.data());
            return;
        }
        Opcode opcode = require(op);
        switch (opcode) {
            case OP_PUSHDATA1, OP_PUSHDATA2, OP_PUSHDATA4 -> context.mainStack().push(op.data());
            default -> context.mainStack().pushNumber(opcode.smallIntegerValue());
        }
    }
}
