package org.silverscript.compiler.diagnostics;

import org.silverscript.compiler.api.CompilationException;
import org.silverscript.compiler.api.CompilerErrorCode;
import org.silverscript.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one compilation. The lexer, parser and semantic analyzer report
 * here instead of throwing, so that a phase can report several problems at once.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code The error code.
     * @param message The error message.
     * @param span The offending location, or {@code null}.
     */
    public void reportError(CompilerErrorCode code, String message, SourceSpan span) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, span));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param span The location, or {@code null}.
     */
    public void reportWarning(String message, SourceSpan span) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, null, message, span));
    }

    /**
     * @return {@code true} if at least one error exists.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return An unmodifiable list of all collected diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return The first reported error, if any.
     */
    public Optional<Diagnostic> firstError() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).findFirst();
    }

    /**
     * Throws the first reported error, if any.
     *
     * @param kind The phase the collected errors belong to.
     * @throws CompilationException carrying the code and span of the first error.
     */
    public void throwIfErrors(CompilationException.Kind kind) throws CompilationException {
        Optional<Diagnostic> first = firstError();
        if (first.isPresent()) {
            Diagnostic d = first.get();
            throw new CompilationException(kind, d.code(), d.message(), d.span());
        }
    }

    /**
     * @return All collected diagnostics, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
