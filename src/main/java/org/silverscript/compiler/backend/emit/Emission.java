package org.silverscript.compiler.backend.emit;

import org.silverscript.debug.DebugTable;

/**
 * The output of the emitter.
 *
 * @param bytecode The locking script.
 * @param debugTable The mappings of its source-attributed instructions.
 */
public record Emission(byte[] bytecode, DebugTable debugTable) {

    public Emission {
        bytecode = bytecode.clone();
    }

    @Override
    public byte[] bytecode() {
        return bytecode.clone();
    }
}
