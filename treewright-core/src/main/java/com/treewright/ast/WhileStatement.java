package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

/**
 * {@code while (condition) embeddedStatement}
 */
public final class WhileStatement extends Statement {

    public WhileStatement() {
        super(NodeKind.WHILE_STATEMENT);
    }

    public TokenNode getWhileToken() {
        return getTypedChild(Roles.WHILE_KEYWORD, TokenNode.class);
    }

    public Expression getCondition() {
        return getTypedChild(Roles.CONDITION, Expression.class);
    }

    public void setCondition(Expression condition) {
        setChildByRole(Roles.CONDITION, condition);
    }

    public Statement getEmbeddedStatement() {
        return getTypedChild(Roles.EMBEDDED_STATEMENT, Statement.class);
    }

    public void setEmbeddedStatement(Statement statement) {
        setChildByRole(Roles.EMBEDDED_STATEMENT, statement);
    }

    @Override
    protected AstNode newInstance() {
        return new WhileStatement();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitWhileStatement(this, data);
    }
}
