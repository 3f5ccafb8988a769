package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

public final class IdentifierExpression extends Expression {

    public IdentifierExpression() {
        super(NodeKind.IDENTIFIER_EXPRESSION);
    }

    public TokenNode getIdentifierToken() {
        return getTypedChild(Roles.IDENTIFIER, TokenNode.class);
    }

    public String getIdentifier() {
        return getTokenText(Roles.IDENTIFIER);
    }

    @Override
    protected AstNode newInstance() {
        return new IdentifierExpression();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitIdentifierExpression(this, data);
    }
}
