package org.silverscript.trace.model;

import java.util.List;

/**
 * Summary of a trace.
 *
 * @param contractName The contract.
 * @param functionName The called entrypoint.
 * @param selectorIndex Its selector, absent without dispatch.
 * @param ctorArgs The raw constructor arguments after default filling.
 * @param args The raw function arguments after default filling and signing.
 * @param withoutSelector {@code true} iff the contract has a single entrypoint.
 * @param sigscriptHex The unlocking input.
 * @param sigscriptLen Its length in bytes.
 * @param scriptLen The bytecode length.
 * @param opcodeCount The number of locking-script instructions.
 * @param opcodeStepCount The number of opcode snapshots.
 * @param sourceStepCount The number of source snapshots.
 * @param generatedAtUnixMs The wall-clock creation time.
 */
public record TraceMeta(
        String contractName,
        String functionName,
        Integer selectorIndex,
        List<String> ctorArgs,
        List<String> args,
        boolean withoutSelector,
        String sigscriptHex,
        int sigscriptLen,
        int scriptLen,
        int opcodeCount,
        int opcodeStepCount,
        int sourceStepCount,
        long generatedAtUnixMs
) {
    public TraceMeta {
        ctorArgs = List.copyOf(ctorArgs);
        args = List.copyOf(args);
    }
}
