package org.silverscript.compiler.api;

import org.silverscript.debug.DebugTable;

import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * The immutable result of compiling a contract with concrete constructor arguments.
 */
public final class CompiledProgram {

    private final String contractName;
    private final byte[] bytecode;
    private final List<FunctionSignature> abi;
    private final boolean withoutSelector;
    private final DebugTable debugInfo;
    private final List<ParamInfo> constructorParams;

    /**
     * @param contractName The contract name.
     * @param bytecode The locking script.
     * @param abi The entrypoint functions in declaration order.
     * @param withoutSelector {@code true} iff the contract has exactly one entrypoint.
     * @param debugInfo The debug table of the bytecode.
     * @param constructorParams The constructor parameters the program was specialized for.
     */
    public CompiledProgram(String contractName, byte[] bytecode, List<FunctionSignature> abi,
                           boolean withoutSelector, DebugTable debugInfo, List<ParamInfo> constructorParams) {
        this.contractName = contractName;
        this.bytecode = bytecode.clone();
        this.abi = List.copyOf(abi);
        this.withoutSelector = withoutSelector;
        this.debugInfo = debugInfo;
        this.constructorParams = List.copyOf(constructorParams);
    }

    public String contractName() {
        return contractName;
    }

    public byte[] bytecode() {
        return bytecode.clone();
    }

    public String bytecodeHex() {
        return HexFormat.of().formatHex(bytecode);
    }

    public List<FunctionSignature> abi() {
        return abi;
    }

    public boolean withoutSelector() {
        return withoutSelector;
    }

    public DebugTable debugInfo() {
        return debugInfo;
    }

    public List<ParamInfo> constructorParams() {
        return constructorParams;
    }

    /**
     * @param name A function name.
     * @return The ABI entry of that entrypoint, if any.
     */
    public Optional<FunctionSignature> function(String name) {
        return abi.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
