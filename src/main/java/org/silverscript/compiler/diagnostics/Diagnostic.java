package org.silverscript.compiler.diagnostics;

import org.silverscript.compiler.api.CompilerErrorCode;
import org.silverscript.compiler.api.SourceSpan;

/**
 * Represents a single diagnostic message that occurs during the compilation process.
 *
 * @param type The severity of the diagnostic.
 * @param code The error code; {@code null} for warnings.
 * @param message The diagnostic message.
 * @param span The source location, or {@code null} if unknown.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        SourceSpan span
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    @Override
    public String toString() {
        String where = span == null ? "?" : span.toString();
        return code == null
                ? String.format("[%s] %s: %s", type, where, message)
                : String.format("[%s] %s: %s (%s)", type, where, message, code);
    }
}
