package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

/**
 * Prefix operator: {@code !x}, {@code -x}, {@code ++x}.
 */
public final class UnaryOperatorExpression extends Expression {

    public UnaryOperatorExpression() {
        super(NodeKind.UNARY_OPERATOR_EXPRESSION);
    }

    public String getOperator() {
        return getTokenText(Roles.OPERATOR);
    }

    public Expression getExpression() {
        return getTypedChild(Roles.EXPRESSION, Expression.class);
    }

    public void setExpression(Expression expression) {
        setChildByRole(Roles.EXPRESSION, expression);
    }

    @Override
    protected AstNode newInstance() {
        return new UnaryOperatorExpression();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitUnaryOperatorExpression(this, data);
    }
}
