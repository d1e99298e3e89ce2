package org.silverscript.trace.model;

import org.silverscript.compiler.api.SourceSpan;

/**
 * A source range; lines and columns are 1-based, the end column is exclusive.
 */
public record SpanView(int line, int col, int endLine, int endCol) {

    public static SpanView of(SourceSpan span) {
        return span == null ? null : new SpanView(span.line(), span.column(), span.endLine(), span.endColumn());
    }
}
