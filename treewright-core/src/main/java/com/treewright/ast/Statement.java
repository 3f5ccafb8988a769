package com.treewright.ast;

public abstract class Statement extends AstNode {

    protected Statement(NodeKind kind) {
        super(kind);
    }
}
