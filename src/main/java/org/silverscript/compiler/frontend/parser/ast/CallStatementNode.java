package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * A call of a helper function as a statement; the helper is inlined.
 *
 * @param call The call.
 * @param span The statement range.
 */
public record CallStatementNode(CallNode call, SourceSpan span) implements StatementNode {
}
