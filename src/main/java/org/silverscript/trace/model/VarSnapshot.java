package org.silverscript.trace.model;

/**
 * A resolved variable.
 *
 * @param name The variable name.
 * @param origin {@code const}, {@code arg} or {@code local}.
 * @param typeName The declared type.
 * @param value The formatted value.
 */
public record VarSnapshot(String name, String origin, String typeName, String value) {
}
