package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

public final class ParenthesizedExpression extends Expression {

    public ParenthesizedExpression() {
        super(NodeKind.PARENTHESIZED_EXPRESSION);
    }

    public Expression getExpression() {
        return getTypedChild(Roles.EXPRESSION, Expression.class);
    }

    public void setExpression(Expression expression) {
        setChildByRole(Roles.EXPRESSION, expression);
    }

    @Override
    protected AstNode newInstance() {
        return new ParenthesizedExpression();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitParenthesizedExpression(this, data);
    }
}
