package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

public final class BinaryOperatorExpression extends Expression {

    public BinaryOperatorExpression() {
        super(NodeKind.BINARY_OPERATOR_EXPRESSION);
    }

    public Expression getLeft() {
        return getTypedChild(Roles.LEFT, Expression.class);
    }

    public void setLeft(Expression left) {
        setChildByRole(Roles.LEFT, left);
    }

    public String getOperator() {
        return getTokenText(Roles.OPERATOR);
    }

    public Expression getRight() {
        return getTypedChild(Roles.RIGHT, Expression.class);
    }

    public void setRight(Expression right) {
        setChildByRole(Roles.RIGHT, right);
    }

    @Override
    protected AstNode newInstance() {
        return new BinaryOperatorExpression();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitBinaryOperatorExpression(this, data);
    }
}
