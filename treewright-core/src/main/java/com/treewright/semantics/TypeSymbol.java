package com.treewright.semantics;

public interface TypeSymbol extends Symbol {

    @Override
    default SymbolKind getKind() {
        return SymbolKind.TYPE;
    }

    /**
     * The base type, or null for a root type or when unknown.
     */
    TypeSymbol getBaseType();

    default boolean isSubtypeOf(String qualifiedName) {
        for (TypeSymbol type = this; type != null; type = type.getBaseType()) {
            if (type.getQualifiedName().equals(qualifiedName)) {
                return true;
            }
        }
        return false;
    }
}
