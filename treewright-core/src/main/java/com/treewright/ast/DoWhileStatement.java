package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

/**
 * {@code do embeddedStatement while (condition);}
 */
public final class DoWhileStatement extends Statement {

    public DoWhileStatement() {
        super(NodeKind.DO_WHILE_STATEMENT);
    }

    public TokenNode getDoToken() {
        return getTypedChild(Roles.DO_KEYWORD, TokenNode.class);
    }

    public Statement getEmbeddedStatement() {
        return getTypedChild(Roles.EMBEDDED_STATEMENT, Statement.class);
    }

    public void setEmbeddedStatement(Statement statement) {
        setChildByRole(Roles.EMBEDDED_STATEMENT, statement);
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

    @Override
    protected AstNode newInstance() {
        return new DoWhileStatement();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitDoWhileStatement(this, data);
    }
}
