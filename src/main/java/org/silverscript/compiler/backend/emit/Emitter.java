package org.silverscript.compiler.backend.emit;

import org.silverscript.compiler.ir.IrInstruction;
import org.silverscript.compiler.ir.IrItem;
import org.silverscript.compiler.ir.IrProgram;
import org.silverscript.compiler.ir.IrPush;
import org.silverscript.compiler.ir.IrSource;
import org.silverscript.debug.DebugMapping;
import org.silverscript.debug.DebugTable;
import org.silverscript.runtime.ScriptBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * The Emitter is the final stage of the compiler backend. It encodes the IR into bytecode and
 * records a {@link DebugMapping} for every item that carries source attribution. Mapped items
 * are numbered in emission order, so sequence numbers grow with the byte offset.
 */
public class Emitter {

    /**
     * Emits the bytecode and debug table of a program.
     *
     * @param program The IR program.
     * @return The emission result.
     */
    public Emission emit(IrProgram program) {
        ScriptBuilder script = new ScriptBuilder();
        List<DebugMapping> mappings = new ArrayList<>();
        int sequence = 0;
        for (IrItem item : program.items()) {
            int offset = script.size();
            if (item instanceof IrPush push) {
                script.addData(push.data());
            } else if (item instanceof IrInstruction instruction) {
                script.addOp(instruction.opcode());
            } else {
                throw new IllegalStateException("Unknown IR item " + item.getClass().getSimpleName());
            }
            IrSource source = item.source();
            if (source != null) {
                mappings.add(new DebugMapping(offset, sequence++, source.frameId(), source.entrypoint(),
                        source.callDepth(), source.span(), source.statementBoundary(), source.scope()));
            }
        }
        return new Emission(script.build(), new DebugTable(mappings, program.frames()));
    }
}
