package org.silverscript.compiler.frontend.semantics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table with nested block scopes. The outermost scope holds the constructor parameters
 * and stays open for the whole contract.
 */
public class SymbolTable {

    private final Deque<Map<String, Symbol>> scopes = new ArrayDeque<>();

    /**
     * Constructs a table with an empty outermost scope.
     */
    public SymbolTable() {
        scopes.push(new HashMap<>());
    }

    /**
     * Enters a new scope.
     */
    public void enterScope() {
        scopes.push(new HashMap<>());
    }

    /**
     * Leaves the current scope. The outermost scope is never left.
     */
    public void leaveScope() {
        if (scopes.size() > 1) {
            scopes.pop();
        }
    }

    /**
     * Defines a symbol in the current scope.
     * @param symbol The symbol.
     * @return {@code false} if a symbol with the same name is already visible.
     */
    public boolean define(Symbol symbol) {
        if (resolve(symbol.name()).isPresent()) {
            return false;
        }
        scopes.peek().put(symbol.name(), symbol);
        return true;
    }

    /**
     * Resolves a name from the innermost scope outwards.
     * @param name The name.
     * @return The symbol, if visible.
     */
    public Optional<Symbol> resolve(String name) {
        for (Map<String, Symbol> scope : scopes) {
            Symbol s = scope.get(name);
            if (s != null) return Optional.of(s);
        }
        return Optional.empty();
    }
}
