package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

/**
 * {@code target.member}
 */
public final class MemberReferenceExpression extends Expression {

    public MemberReferenceExpression() {
        super(NodeKind.MEMBER_REFERENCE_EXPRESSION);
    }

    public Expression getTarget() {
        return getTypedChild(Roles.TARGET, Expression.class);
    }

    public void setTarget(Expression target) {
        setChildByRole(Roles.TARGET, target);
    }

    public String getMemberName() {
        return getTokenText(Roles.IDENTIFIER);
    }

    @Override
    protected AstNode newInstance() {
        return new MemberReferenceExpression();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitMemberReferenceExpression(this, data);
    }
}
