package org.silverscript.trace.model;

import org.silverscript.trace.TraceException;

/**
 * A request failure as returned to clients.
 *
 * @param kind {@code parse}, {@code compile}, {@code argument} or {@code execution}.
 * @param error The message.
 * @param span The offending source range, if known.
 */
public record ErrorView(String kind, String error, SpanView span) {

    public static ErrorView of(TraceException e) {
        return new ErrorView(e.kind().name().toLowerCase(), e.getMessage(), e.span().map(SpanView::of).orElse(null));
    }
}
