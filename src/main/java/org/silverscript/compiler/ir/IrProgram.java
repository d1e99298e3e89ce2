package org.silverscript.compiler.ir;

import org.silverscript.debug.FrameInfo;

import java.util.List;

/**
 * The flat, fully inlined program of one contract.
 *
 * @param contractName The contract name.
 * @param items The items in program order.
 * @param frames All frames referenced by the items.
 */
public record IrProgram(String contractName, List<IrItem> items, List<FrameInfo> frames) {

    public IrProgram {
        items = List.copyOf(items);
        frames = List.copyOf(frames);
    }
}
