package org.silverscript.trace;

import org.silverscript.compiler.api.CompilationException;
import org.silverscript.compiler.api.SourceSpan;

import java.util.Optional;

/**
 * A failure of a trace, input or outline request, classified for the caller. Execution errors
 * inside a trace do not raise this; they are recorded in the failing step.
 */
public class TraceException extends Exception {

    /**
     * What went wrong.
     */
    public enum Kind {
        /** The source text is malformed. */
        PARSE,
        /** The contract violates the language rules. */
        COMPILE,
        /** A constructor or function argument is missing, malformed or of the wrong type. */
        ARGUMENT,
        /** The scripts could not be loaded into the engine. */
        EXECUTION
    }

    private final Kind kind;
    private final SourceSpan span;

    public TraceException(Kind kind, String message, SourceSpan span, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.span = span;
    }

    public TraceException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    /**
     * Wraps a compiler error, preserving its phase and location.
     * @param e The compiler error.
     * @return The trace error.
     */
    public static TraceException from(CompilationException e) {
        Kind kind = e.kind() == CompilationException.Kind.PARSE ? Kind.PARSE : Kind.COMPILE;
        return new TraceException(kind, e.getMessage(), e.span().orElse(null), e);
    }

    public Kind kind() {
        return kind;
    }

    public Optional<SourceSpan> span() {
        return Optional.ofNullable(span);
    }
}
