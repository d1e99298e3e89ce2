package org.silverscript.runtime.isa;

import org.silverscript.runtime.ParsedOpcode;
import org.silverscript.runtime.ScriptExecutionException;
import org.silverscript.runtime.internal.ExecutionContext;

/**
 * The base class of all instruction families. A family executes every opcode of one
 * {@link Opcode.Category}; instances are stateless and shared.
 */
public abstract class Instruction {

    /**
     * Executes one decoded instruction.
     *
     * @param op The instruction.
     * @param context The engine state to operate on.
     * @throws ScriptExecutionException if the instruction fails.
     */
    public abstract void execute(ParsedOpcode op, ExecutionContext context) throws ScriptExecutionException;

    /**
     * Resolves the named opcode or fails for unassigned bytes.
     * @param op The instruction.
     * @return The named opcode.
     * @throws ScriptExecutionException for an unassigned opcode byte.
     */
    protected static Opcode require(ParsedOpcode op) throws ScriptExecutionException {
        return op.opcode().orElseThrow(() -> new ScriptExecutionException(
                String.format("invalid opcode 0x%02x at offset %d", op.code(), op.offset())));
    }

    /**
     * @param op The opcode this family does not implement.
     * @return An exception describing the dispatch error.
     */
    protected ScriptExecutionException unsupported(Opcode op) {
        return new ScriptExecutionException(op.name() + " is not handled by " + getClass().getSimpleName());
    }
}
