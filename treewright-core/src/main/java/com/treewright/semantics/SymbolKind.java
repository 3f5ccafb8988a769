package com.treewright.semantics;

public enum SymbolKind {
    TYPE,
    METHOD,
    PARAMETER,
    LOCAL,
    FIELD,
    ATTRIBUTE
}
