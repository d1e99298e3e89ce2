package org.silverscript.compiler.frontend.lexer;

import org.silverscript.compiler.api.SourceSpan;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value of literals, {@code null} otherwise.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {
    /**
     * @return The source range covered by the token. Tokens never span lines.
     */
    public SourceSpan span() {
        return new SourceSpan(line, column, line, column + text.length());
    }
}
