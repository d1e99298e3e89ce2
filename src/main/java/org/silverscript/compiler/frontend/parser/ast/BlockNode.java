package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

import java.util.List;

/**
 * A braced statement list; variables declared inside are dropped at its end.
 *
 * @param statements The statements.
 * @param span The range from the opening to the closing brace.
 */
public record BlockNode(List<StatementNode> statements, SourceSpan span) implements StatementNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }
}
