package com.treewright.ast;

public abstract class Expression extends AstNode {

    protected Expression(NodeKind kind) {
        super(kind);
    }
}
