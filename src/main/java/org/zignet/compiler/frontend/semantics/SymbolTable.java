package org.zignet.compiler.frontend.semantics;

import org.zignet.compiler.diagnostics.DiagnosticsEngine;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for managing scopes and symbols during type checking.
 * It supports nested scopes and resolving symbols based on the current scope.
 */
public class SymbolTable {

    /**
     * Represents a single scope in the symbol table.
     */
    private static final class Scope {
        private final Scope parent;
        private final Map<String, Symbol> symbols = new HashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }
    }

    private Scope currentScope;
    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a new symbol table.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public SymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.currentScope = new Scope(null);
    }

    /**
     * Enters a new scope nested in the current one.
     */
    public void enterScope() {
        currentScope = new Scope(currentScope);
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     * @throws IllegalStateException if the current scope is the root scope.
     */
    public void leaveScope() {
        if (currentScope.parent == null) {
            throw new IllegalStateException("Cannot leave the global scope.");
        }
        currentScope = currentScope.parent;
    }

    /**
     * Defines a new symbol in the current scope.
     * Reports an error if the name is already defined in the current scope; outer scopes may be shadowed.
     * @param symbol The symbol to define.
     * @return {@code true} if the symbol was added.
     */
    public boolean define(Symbol symbol) {
        if (currentScope.symbols.containsKey(symbol.name())) {
            diagnostics.reportError(
                    "Symbol '" + symbol.name() + "' already defined in this scope",
                    symbol.node().line(),
                    symbol.node().column()
            );
            return false;
        }
        currentScope.symbols.put(symbol.name(), symbol);
        return true;
    }

    /**
     * Resolves a symbol by name, searching from the current scope upwards to the root.
     * @param name The name of the symbol to resolve.
     * @return An optional containing the found symbol, or empty if not found.
     */
    public Optional<Symbol> resolve(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) return Optional.of(symbol);
        }
        return Optional.empty();
    }
}
