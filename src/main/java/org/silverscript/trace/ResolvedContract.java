package org.silverscript.trace;

import org.silverscript.compiler.api.CompiledProgram;
import org.silverscript.compiler.api.FunctionSignature;

import java.util.List;

/**
 * A compiled contract together with a fully prepared call of one of its entrypoints.
 *
 * @param program The compiled program.
 * @param function The selected entrypoint.
 * @param rawCtorArgs The constructor arguments after default filling.
 * @param signedArgs The function arguments after default filling and signing.
 * @param unlockingInput The unlocking script built from {@code signedArgs}.
 */
public record ResolvedContract(CompiledProgram program, FunctionSignature function, List<String> rawCtorArgs,
                               List<String> signedArgs, byte[] unlockingInput) {

    public ResolvedContract {
        rawCtorArgs = List.copyOf(rawCtorArgs);
        signedArgs = List.copyOf(signedArgs);
        unlockingInput = unlockingInput.clone();
    }

    @Override
    public byte[] unlockingInput() {
        return unlockingInput.clone();
    }
}
