package org.silverscript.trace.model;

/**
 * A built unlocking input.
 *
 * @param contractName The contract.
 * @param functionName The called entrypoint.
 * @param selectorIndex Its selector, absent without dispatch.
 * @param sigscriptHex The unlocking input.
 * @param sigscriptLen Its length in bytes.
 * @param withoutSelector {@code true} iff the contract has a single entrypoint.
 */
public record UnlockingInputView(String contractName, String functionName, Integer selectorIndex,
                                 String sigscriptHex, int sigscriptLen, boolean withoutSelector) {
}
