package org.zignet.compiler.frontend.semantics;

import org.zignet.compiler.frontend.parser.ast.AstNode;

/**
 * Represents a single named entity (a variable, a parameter, a function or a type)
 * in the symbol table.
 *
 * @param name The name of the symbol.
 * @param kind The kind of the symbol.
 * @param type The type of the symbol. For {@link Kind#TYPE} symbols this is the declared type itself.
 * @param isConst Whether assignments to the symbol are rejected.
 * @param node The AST node that introduced the symbol.
 */
public record Symbol(String name, Kind kind, Type type, boolean isConst, AstNode node) {
    /**
     * The kind of a symbol in the symbol table.
     */
    public enum Kind {
        /** A variable declared with {@code const} or {@code var}. */
        VARIABLE,
        /** A function parameter. */
        PARAMETER,
        /** A top-level function. */
        FUNCTION,
        /** A struct, union or enum declaration. */
        TYPE
    }
}
