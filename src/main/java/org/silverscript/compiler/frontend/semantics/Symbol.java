package org.silverscript.compiler.frontend.semantics;

import org.silverscript.compiler.api.ValueType;
import org.silverscript.compiler.frontend.parser.ast.AstNode;

/**
 * Represents a single named value in the symbol table.
 *
 * @param name The symbol name.
 * @param kind What declared the symbol.
 * @param type The declared type.
 * @param declaration The declaring AST node.
 */
public record Symbol(String name, Kind kind, ValueType type, AstNode declaration) {
    /**
     * The kind of declaration a symbol comes from.
     */
    public enum Kind {
        /** A constructor parameter; its value is fixed at compile time. */
        CONSTANT,
        /** A function parameter. */
        PARAMETER,
        /** A variable declared in a function body. */
        LOCAL
    }
}
