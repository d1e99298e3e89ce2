package org.silverscript.compiler.ir;

import org.silverscript.runtime.isa.Opcode;

/**
 * A non-push opcode.
 *
 * @param opcode The opcode.
 * @param source The source attribution, or {@code null}.
 */
public record IrInstruction(Opcode opcode, IrSource source) implements IrItem {

    @Override
    public String toString() {
        return opcode.name();
    }
}
