package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

import java.util.List;

/**
 * {@code target(arguments)}
 */
public final class InvocationExpression extends Expression {

    public InvocationExpression() {
        super(NodeKind.INVOCATION_EXPRESSION);
    }

    public Expression getTarget() {
        return getTypedChild(Roles.TARGET, Expression.class);
    }

    public void setTarget(Expression target) {
        setChildByRole(Roles.TARGET, target);
    }

    public List<AstNode> getArguments() {
        return getChildrenByRole(Roles.ARGUMENT);
    }

    public void setArguments(List<? extends AstNode> arguments) {
        setChildrenByRole(Roles.ARGUMENT, arguments);
    }

    @Override
    protected AstNode newInstance() {
        return new InvocationExpression();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitInvocationExpression(this, data);
    }
}
