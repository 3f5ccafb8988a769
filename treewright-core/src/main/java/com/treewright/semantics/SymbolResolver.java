package com.treewright.semantics;

import com.treewright.ast.AstNode;

/**
 * Bridge to a semantic model the tree itself does not have: name binding and types. Rules use
 * it when available and fall back to purely syntactic checks when it answers null.
 */
public interface SymbolResolver {

    /**
     * Resolver that knows nothing.
     */
    SymbolResolver NONE = new SymbolResolver() {
        @Override
        public Symbol resolve(AstNode node) {
            return null;
        }

        @Override
        public TypeSymbol typeOf(AstNode node) {
            return null;
        }
    };

    /**
     * Symbol referenced or declared by {@code node}, or null if unknown.
     */
    Symbol resolve(AstNode node);

    /**
     * Type of the value {@code node} denotes, or null if unknown.
     */
    TypeSymbol typeOf(AstNode node);
}
