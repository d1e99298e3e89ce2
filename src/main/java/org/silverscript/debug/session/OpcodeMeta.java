package org.silverscript.debug.session;

import org.silverscript.debug.DebugMapping;

/**
 * Static description of one locking-script instruction.
 *
 * @param index The instruction index.
 * @param byteOffset The offset of the instruction in the bytecode.
 * @param display The instruction as text, e.g. {@code OP_DATA_2 0x0a0b}.
 * @param mapping The debug mapping at that offset, {@code null} for dispatch and epilogue code.
 */
public record OpcodeMeta(int index, int byteOffset, String display, DebugMapping mapping) {
}
