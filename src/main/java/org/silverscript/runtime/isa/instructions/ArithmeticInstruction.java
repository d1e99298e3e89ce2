package org.silverscript.runtime.isa.instructions;

import org.silverscript.runtime.ExecutionStack;
import org.silverscript.runtime.ParsedOpcode;
import org.silverscript.runtime.ScriptExecutionException;
import org.silverscript.runtime.internal.ExecutionContext;
import org.silverscript.runtime.isa.Instruction;
import org.silverscript.runtime.isa.Opcode;

/**
 * Handles numeric and boolean operations on script numbers.
 * Operands are popped right-hand side first.
 */
public class ArithmeticInstruction extends Instruction {

    @Override
    public void execute(ParsedOpcode op, ExecutionContext context) throws ScriptExecutionException {
        Opcode opcode = require(op);
        try {
            unaryOrBinary(opcode, context.mainStack());
        } catch (ArithmeticException overflow) {
            throw new ScriptExecutionException(opcode.name() + " overflowed", overflow);
        }
    }

    private void unaryOrBinary(Opcode opcode, ExecutionStack stack) throws ScriptExecutionException {
        switch (opcode) {
            case OP_1ADD -> stack.pushNumber(Math.addExact(stack.popNumber(), 1));
            case OP_1SUB -> stack.pushNumber(Math.subtractExact(stack.popNumber(), 1));
            case OP_NEGATE -> stack.pushNumber(-stack.popNumber());
            case OP_ABS -> stack.pushNumber(Math.abs(stack.popNumber()));
            case OP_NOT -> stack.pushBool(stack.popNumber() == 0);
            case OP_0NOTEQUAL -> stack.pushBool(stack.popNumber() != 0);
            case OP_WITHIN -> {
                long max = stack.popNumber();
                long min = stack.popNumber();
                long x = stack.popNumber();
                stack.pushBool(min <= x && x < max);
            }
            default -> binary(opcode, stack);
        }
    }

    private void binary(Opcode opcode, ExecutionStack stack) throws ScriptExecutionException {
        long b = stack.popNumber();
        long a = stack.popNumber();
        switch (opcode) {
            case OP_ADD -> stack.pushNumber(Math.addExact(a, b));
            case OP_SUB -> stack.pushNumber(Math.subtractExact(a, b));
            case OP_MUL -> stack.pushNumber(Math.multiplyExact(a, b));
            case OP_DIV -> {
                if (b == 0) throw new ScriptExecutionException("division by zero");
                stack.pushNumber(a / b);
            }
            case OP_MOD -> {
                if (b == 0) throw new ScriptExecutionException("modulo by zero");
                stack.pushNumber(a % b);
            }
            case OP_BOOLAND -> stack.pushBool(a != 0 && b != 0);
            case OP_BOOLOR -> stack.pushBool(a != 0 || b != 0);
            case OP_NUMEQUAL -> stack.pushBool(a == b);
            case OP_NUMEQUALVERIFY -> {
                if (a != b) throw new ScriptExecutionException("OP_NUMEQUALVERIFY failed: " + a + " != " + b);
            }
            case OP_NUMNOTEQUAL -> stack.pushBool(a != b);
            case OP_LESSTHAN -> stack.pushBool(a < b);
            case OP_GREATERTHAN -> stack.pushBool(a > b);
            case OP_LESSTHANOREQUAL -> stack.pushBool(a <= b);
            case OP_GREATERTHANOREQUAL -> stack.pushBool(a >= b);
            case OP_MIN -> stack.pushNumber(Math.min(a, b));
            case OP_MAX -> stack.pushNumber(Math.max(a, b));
            default -> throw unsupported(opcode);
        }
    }
}
