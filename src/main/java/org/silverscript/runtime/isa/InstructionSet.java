package org.silverscript.runtime.isa;

import org.silverscript.runtime.ParsedOpcode;
import org.silverscript.runtime.ScriptExecutionException;
import org.silverscript.runtime.isa.instructions.ArithmeticInstruction;
import org.silverscript.runtime.isa.instructions.ControlFlowInstruction;
import org.silverscript.runtime.isa.instructions.CryptoInstruction;
import org.silverscript.runtime.isa.instructions.DataInstruction;
import org.silverscript.runtime.isa.instructions.PushInstruction;
import org.silverscript.runtime.isa.instructions.StackInstruction;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry mapping opcode categories to the instruction family executing them.
 */
public final class InstructionSet {

    private static final Map<Opcode.Category, Instruction> FAMILIES = new EnumMap<>(Opcode.Category.class);
    private static final Instruction PUSH = new PushInstruction();

    static {
        FAMILIES.put(Opcode.Category.PUSH, PUSH);
        FAMILIES.put(Opcode.Category.FLOW, new ControlFlowInstruction());
        FAMILIES.put(Opcode.Category.STACK, new StackInstruction());
        FAMILIES.put(Opcode.Category.DATA, new DataInstruction());
        FAMILIES.put(Opcode.Category.ARITHMETIC, new ArithmeticInstruction());
        FAMILIES.put(Opcode.Category.CRYPTO, new CryptoInstruction());
    }

    private InstructionSet() {}

    /**
     * @param op A decoded instruction.
     * @return The family that executes it.
     * @throws ScriptExecutionException for an unassigned opcode byte.
     */
    public static Instruction resolve(ParsedOpcode op) throws ScriptExecutionException {
        if (Opcode.isDirectPush(op.code())) {
            return PUSH;
        }
        return FAMILIES.get(Instruction.require(op).category());
    }
}
