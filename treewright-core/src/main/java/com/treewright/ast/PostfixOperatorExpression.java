package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

/**
 * {@code x++} or {@code x--}.
 */
public final class PostfixOperatorExpression extends Expression {

    public PostfixOperatorExpression() {
        super(NodeKind.POSTFIX_OPERATOR_EXPRESSION);
    }

    public Expression getExpression() {
        return getTypedChild(Roles.EXPRESSION, Expression.class);
    }

    public void setExpression(Expression expression) {
        setChildByRole(Roles.EXPRESSION, expression);
    }

    public String getOperator() {
        return getTokenText(Roles.OPERATOR);
    }

    @Override
    protected AstNode newInstance() {
        return new PostfixOperatorExpression();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitPostfixOperatorExpression(this, data);
    }
}
