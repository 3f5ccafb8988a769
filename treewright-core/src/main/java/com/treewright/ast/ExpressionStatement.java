package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

public final class ExpressionStatement extends Statement {

    public ExpressionStatement() {
        super(NodeKind.EXPRESSION_STATEMENT);
    }

    public Expression getExpression() {
        return getTypedChild(Roles.EXPRESSION, Expression.class);
    }

    public void setExpression(Expression expression) {
        setChildByRole(Roles.EXPRESSION, expression);
    }

    @Override
    protected AstNode newInstance() {
        return new ExpressionStatement();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitExpressionStatement(this, data);
    }
}
