package org.silverscript.runtime.isa.instructions;

import org.silverscript.runtime.ExecutionStack;
import org.silverscript.runtime.ParsedOpcode;
import org.silverscript.runtime.ScriptExecutionException;
import org.silverscript.runtime.ScriptNumber;
import org.silverscript.runtime.internal.ExecutionContext;
import org.silverscript.runtime.isa.Instruction;
import org.silverscript.runtime.isa.Opcode;

/**
 * Handles stack manipulation on the main and alt stacks.
 */
public class StackInstruction extends Instruction {

    @Override
    public void execute(ParsedOpcode op, ExecutionContext context) throws ScriptExecutionException {
        Opcode opcode = require(op);
        ExecutionStack stack = context.mainStack();
        switch (opcode) {
            case OP_TOALTSTACK -> context.altStack().push(stack.pop());
            case OP_FROMALTSTACK -> stack.push(context.altStack().pop());
            case OP_2DROP -> {
                stack.pop();
                stack.pop();
            }
            case OP_2DUP -> {
                byte[] b = stack.peek(0);
                byte[] a = stack.peek(1);
                stack.push(a);
                stack.push(b);
            }
            case OP_IFDUP -> {
                byte[] top = stack.peek(0);
                if (ScriptNumber.castToBool(top)) {
                    stack.push(top);
                }
            }
            case OP_DEPTH -> stack.pushNumber(stack.size());
            case OP_DROP -> stack.pop();
            case OP_DUP -> stack.push(stack.peek(0));
            case OP_NIP -> stack.remove(1);
            case OP_OVER -> stack.push(stack.peek(1));
            case OP_PICK -> stack.push(stack.peek(popIndex(stack)));
            case OP_ROLL -> stack.push(stack.remove(popIndex(stack)));
            case OP_ROT -> stack.push(stack.remove(2));
            case OP_SWAP -> stack.push(stack.remove(1));
            case OP_TUCK -> stack.insert(2, stack.peek(0));
            default -> throw unsupported(opcode);
        }
    }

    private static int popIndex(ExecutionStack stack) throws ScriptExecutionException {
        long n = stack.popNumber();
        if (n < 0 || n >= stack.size()) {
            throw new ScriptExecutionException("stack index " + n + " out of range for stack of size " + stack.size());
        }
        return (int) n;
    }
}
