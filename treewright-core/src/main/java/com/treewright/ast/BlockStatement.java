package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

import java.util.List;

/**
 * {@code { statements }}
 */
public final class BlockStatement extends Statement {

    public BlockStatement() {
        super(NodeKind.BLOCK_STATEMENT);
    }

    public TokenNode getLBraceToken() {
        return getTypedChild(Roles.L_BRACE, TokenNode.class);
    }

    /**
     * Statements in source order, including recovered {@link ErrorNode}s.
     */
    public List<AstNode> getStatements() {
        return getChildrenByRole(Roles.STATEMENT);
    }

    public void addStatement(AstNode statement) {
        addChild(Roles.STATEMENT, statement);
    }

    public void setStatements(List<? extends AstNode> statements) {
        setChildrenByRole(Roles.STATEMENT, statements);
    }

    public TokenNode getRBraceToken() {
        return getTypedChild(Roles.R_BRACE, TokenNode.class);
    }

    @Override
    protected AstNode newInstance() {
        return new BlockStatement();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitBlockStatement(this, data);
    }
}
