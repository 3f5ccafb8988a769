package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

/**
 * {@code @Name} annotation on a declaration.
 */
public final class Attribute extends AstNode {

    public Attribute() {
        super(NodeKind.ATTRIBUTE);
    }

    public String getName() {
        return getTokenText(Roles.IDENTIFIER);
    }

    @Override
    protected AstNode newInstance() {
        return new Attribute();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitAttribute(this, data);
    }
}
