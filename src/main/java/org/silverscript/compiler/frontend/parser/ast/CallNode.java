package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

import java.util.List;

/**
 * {@code name(arguments)}.
 *
 * @param name The called function.
 * @param arguments The arguments in order.
 * @param span The call range.
 */
public record CallNode(String name, List<ExpressionNode> arguments, SourceSpan span) implements ExpressionNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }
}
