package org.silverscript.compiler.api;

/**
 * Describes a constructor or function parameter.
 *
 * @param name The name of the parameter.
 * @param type The declared type.
 */
public record ParamInfo(String name, ValueType type) {
}
