package com.treewright.ast;

public enum Cardinality {
    ONE,
    MANY
}
