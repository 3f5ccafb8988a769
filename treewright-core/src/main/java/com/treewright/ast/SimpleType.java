package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

public final class SimpleType extends AstNode {

    public SimpleType() {
        super(NodeKind.SIMPLE_TYPE);
    }

    public String getName() {
        return getTokenText(Roles.IDENTIFIER);
    }

    @Override
    protected AstNode newInstance() {
        return new SimpleType();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitSimpleType(this, data);
    }
}
