package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

import java.util.List;

/**
 * A function declaration.
 *
 * @param name The function name.
 * @param entrypoint {@code true} for functions callable from an unlocking input.
 * @param params The parameters in declaration order.
 * @param body The function body.
 * @param span The range of the function name.
 */
public record FunctionNode(String name, boolean entrypoint, List<ParamNode> params, BlockNode body, SourceSpan span)
        implements AstNode {

    public FunctionNode {
        params = List.copyOf(params);
    }
}
