package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

import java.util.List;

/**
 * Placeholder for a region the parser could not make sense of. It keeps the raw tokens so the
 * region still prints verbatim, and it may stand in any role.
 */
public final class ErrorNode extends AstNode {

    public ErrorNode() {
        super(NodeKind.ERROR_NODE);
    }

    public List<TokenNode> getErrorTokens() {
        return getTypedChildren(Roles.ERROR_TOKEN, TokenNode.class);
    }

    public void addErrorToken(TokenNode token) {
        addChild(Roles.ERROR_TOKEN, token);
    }

    @Override
    protected AstNode newInstance() {
        return new ErrorNode();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitErrorNode(this, data);
    }
}
