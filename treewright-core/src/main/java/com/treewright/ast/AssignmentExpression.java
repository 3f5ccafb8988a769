package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

/**
 * {@code left = right} and the compound forms {@code +=}, {@code -=}, {@code *=}, {@code /=}.
 */
public final class AssignmentExpression extends Expression {

    public AssignmentExpression() {
        super(NodeKind.ASSIGNMENT_EXPRESSION);
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
        return new AssignmentExpression();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitAssignmentExpression(this, data);
    }
}
