package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

/**
 * {@code Type name = initializer;} with a single declarator. The initializer is optional.
 */
public final class VariableDeclarationStatement extends Statement {

    public VariableDeclarationStatement() {
        super(NodeKind.VARIABLE_DECLARATION_STATEMENT);
    }

    public SimpleType getType() {
        return getTypedChild(Roles.TYPE, SimpleType.class);
    }

    public void setType(SimpleType type) {
        setChildByRole(Roles.TYPE, type);
    }

    public TokenNode getNameToken() {
        return getTypedChild(Roles.IDENTIFIER, TokenNode.class);
    }

    public String getName() {
        return getTokenText(Roles.IDENTIFIER);
    }

    public Expression getInitializer() {
        return getTypedChild(Roles.INITIALIZER, Expression.class);
    }

    public void setInitializer(Expression initializer) {
        setChildByRole(Roles.INITIALIZER, initializer);
    }

    @Override
    protected AstNode newInstance() {
        return new VariableDeclarationStatement();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitVariableDeclarationStatement(this, data);
    }
}
