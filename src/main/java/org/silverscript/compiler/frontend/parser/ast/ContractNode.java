package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

import java.util.List;

/**
 * The root of a parsed source file.
 *
 * @param name The contract name.
 * @param params The constructor parameters.
 * @param functions The functions in declaration order.
 * @param span The range of the contract name.
 */
public record ContractNode(String name, List<ParamNode> params, List<FunctionNode> functions, SourceSpan span)
        implements AstNode {

    public ContractNode {
        params = List.copyOf(params);
        functions = List.copyOf(functions);
    }

    /**
     * @return The entrypoint functions in declaration order.
     */
    public List<FunctionNode> entrypoints() {
        return functions.stream().filter(FunctionNode::entrypoint).toList();
    }
}
