package org.silverscript.runtime.isa.instructions;

import org.silverscript.runtime.ExecutionStack;
import org.silverscript.runtime.ParsedOpcode;
import org.silverscript.runtime.ScriptExecutionException;
import org.silverscript.runtime.internal.ExecutionContext;
import org.silverscript.runtime.isa.Instruction;
import org.silverscript.runtime.isa.Opcode;

import java.util.Arrays;

/**
 * Handles byte-string operations: concatenation, size and equality.
 */
public class DataInstruction extends Instruction {

    /** Maximum size of a single stack element. */
    public static final int MAX_ELEMENT_SIZE = 520;

    @Override
    public void execute(ParsedOpcode op, ExecutionContext context) throws ScriptExecutionException {
        Opcode opcode = require(op);
        ExecutionStack stack = context.mainStack();
        switch (opcode) {
            case OP_CAT -> {
                byte[] b = stack.pop();
                byte[] a = stack.pop();
                if (a.length + b.length > MAX_ELEMENT_SIZE) {
                    throw new ScriptExecutionException("OP_CAT result of " + (a.length + b.length)
                            + " bytes exceeds the element size limit of " + MAX_ELEMENT_SIZE);
                }
                byte[] out = Arrays.copyOf(a, a.length + b.length);
                System.arraycopy(b, 0, out, a.length, b.length);
                stack.push(out);
            }
            case OP_SIZE -> stack.pushNumber(stack.peek(0).length);
            case OP_EQUAL -> stack.pushBool(Arrays.equals(stack.pop(), stack.pop()));
            case OP_EQUALVERIFY -> {
                if (!Arrays.equals(stack.pop(), stack.pop())) {
                    throw new ScriptExecutionException("OP_EQUALVERIFY failed: elements differ");
                }
            }
            default -> throw unsupported(opcode);
        }
    }
}
