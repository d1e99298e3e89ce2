package org.silverscript.compiler.api;

/**
 * A location in SilverScript source text. Lines and columns are 1-based; the end column is
 * exclusive. A point location has {@code endLine == line} and {@code endColumn == column}.
 *
 * @param line The first line.
 * @param column The first column.
 * @param endLine The last line.
 * @param endColumn The column after the last character.
 */
public record SourceSpan(int line, int column, int endLine, int endColumn) {

    /**
     * @param line The line.
     * @param column The column.
     * @return A span covering a single position.
     */
    public static SourceSpan point(int line, int column) {
        return new SourceSpan(line, column, line, column);
    }

    /**
     * @param first The span that starts first.
     * @param last The span that ends last.
     * @return A span from the start of {@code first} to the end of {@code last}.
     */
    public static SourceSpan covering(SourceSpan first, SourceSpan last) {
        return new SourceSpan(first.line, first.column, last.endLine, last.endColumn);
    }

    /**
     * @return {@code true} if this span denotes a single position.
     */
    public boolean isPoint() {
        return line == endLine && column == endColumn;
    }

    @Override
    public String toString() {
        return isPoint() ? line + ":" + column : line + ":" + column + "-" + endLine + ":" + endColumn;
    }
}
