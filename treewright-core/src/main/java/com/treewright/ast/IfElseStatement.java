package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

public final class IfElseStatement extends Statement {

    public IfElseStatement() {
        super(NodeKind.IF_ELSE_STATEMENT);
    }

    public Expression getCondition() {
        return getTypedChild(Roles.CONDITION, Expression.class);
    }

    public void setCondition(Expression condition) {
        setChildByRole(Roles.CONDITION, condition);
    }

    public Statement getTrueStatement() {
        return getTypedChild(Roles.TRUE_STATEMENT, Statement.class);
    }

    public void setTrueStatement(Statement statement) {
        setChildByRole(Roles.TRUE_STATEMENT, statement);
    }

    /**
     * The else branch, or null when there is none.
     */
    public Statement getFalseStatement() {
        return getTypedChild(Roles.FALSE_STATEMENT, Statement.class);
    }

    public void setFalseStatement(Statement statement) {
        setChildByRole(Roles.FALSE_STATEMENT, statement);
    }

    @Override
    protected AstNode newInstance() {
        return new IfElseStatement();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitIfElseStatement(this, data);
    }
}
