package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

public final class ReturnStatement extends Statement {

    public ReturnStatement() {
        super(NodeKind.RETURN_STATEMENT);
    }

    /**
     * The returned value, or null for a bare {@code return;}.
     */
    public Expression getExpression() {
        return getTypedChild(Roles.EXPRESSION, Expression.class);
    }

    public void setExpression(Expression expression) {
        setChildByRole(Roles.EXPRESSION, expression);
    }

    @Override
    protected AstNode newInstance() {
        return new ReturnStatement();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitReturnStatement(this, data);
    }
}
