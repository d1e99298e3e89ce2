package org.silverscript.compiler.api;

import java.util.Optional;

/**
 * An exception that is thrown when source text cannot be parsed or compiled.
 * <p>
 * It is part of the public API and hides the internal diagnostics of the compiler. The source
 * location is carried unchanged from the phase that detected the problem.
 */
public class CompilationException extends Exception {

    /**
     * The phase an error originates from.
     */
    public enum Kind {
        /** Malformed source text. */
        PARSE,
        /** Well-formed source that violates the language rules. */
        COMPILE
    }

    private final Kind kind;
    private final CompilerErrorCode code;
    private final String detail;
    private final SourceSpan span;

    /**
     * Constructs a new compilation exception.
     * @param kind The phase the error originates from.
     * @param code The error code.
     * @param detail The error message without location.
     * @param span The offending location, or {@code null} if none is known.
     */
    public CompilationException(Kind kind, CompilerErrorCode code, String detail, SourceSpan span) {
        super(span == null ? detail : String.format("%s at %s", detail, span));
        this.kind = kind;
        this.code = code;
        this.detail = detail;
        this.span = span;
    }

    public Kind kind() {
        return kind;
    }

    public CompilerErrorCode code() {
        return code;
    }

    /**
     * @return The error message without the location suffix.
     */
    public String detail() {
        return detail;
    }

    public Optional<SourceSpan> span() {
        return Optional.ofNullable(span);
    }
}
