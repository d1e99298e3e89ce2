package org.silverscript.compiler.api;

import java.util.List;

/**
 * The ABI entry of one entrypoint function.
 *
 * @param name The function name.
 * @param parameters The parameters in declaration order.
 * @param selectorIndex The dispatch selector, or {@code null} when the contract has a single entrypoint.
 */
public record FunctionSignature(String name, List<ParamInfo> parameters, Integer selectorIndex) {

    public FunctionSignature {
        parameters = List.copyOf(parameters);
    }
}
