package org.silverscript.compiler.api;

import org.silverscript.compiler.frontend.parser.ast.ContractNode;
import org.silverscript.compiler.frontend.parser.ast.FunctionNode;
import org.silverscript.compiler.frontend.parser.ast.ParamNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The callable surface of a contract, derived from its syntax tree without compiling it.
 *
 * @param contractName The contract name.
 * @param constructorParams The constructor parameters.
 * @param functions The entrypoint functions with their selector indices.
 * @param withoutSelector {@code true} iff there is exactly one entrypoint.
 */
public record ContractOutline(
        String contractName,
        List<ParamInfo> constructorParams,
        List<FunctionSignature> functions,
        boolean withoutSelector
) {
    public ContractOutline {
        constructorParams = List.copyOf(constructorParams);
        functions = List.copyOf(functions);
    }

    /**
     * Builds the outline of a parsed contract.
     *
     * @param contract The syntax tree.
     * @return The outline.
     * @throws CompilationException if the contract has no entrypoint or uses an unknown type.
     */
    public static ContractOutline of(ContractNode contract) throws CompilationException {
        List<FunctionNode> entrypoints = contract.entrypoints();
        if (entrypoints.isEmpty()) {
            throw new CompilationException(CompilationException.Kind.COMPILE, CompilerErrorCode.MISSING_ENTRYPOINT,
                    "contract has no entrypoint functions", contract.span());
        }
        boolean withoutSelector = entrypoints.size() == 1;
        List<FunctionSignature> functions = new ArrayList<>();
        for (int i = 0; i < entrypoints.size(); i++) {
            FunctionNode f = entrypoints.get(i);
            functions.add(new FunctionSignature(f.name(), params(f.params()), withoutSelector ? null : i));
        }
        return new ContractOutline(contract.name(), params(contract.params()), functions, withoutSelector);
    }

    /**
     * Resolves declared parameter types.
     *
     * @param params Parameters as parsed.
     * @return The typed parameters.
     * @throws CompilationException for an unknown type name.
     */
    public static List<ParamInfo> params(List<ParamNode> params) throws CompilationException {
        List<ParamInfo> out = new ArrayList<>(params.size());
        for (ParamNode p : params) {
            ValueType type = ValueType.parse(p.type().text()).orElseThrow(() -> new CompilationException(
                    CompilationException.Kind.COMPILE, CompilerErrorCode.UNKNOWN_TYPE,
                    "unknown type '" + p.type().text() + "'", p.type().span()));
            out.add(new ParamInfo(p.name(), type));
        }
        return out;
    }
}
