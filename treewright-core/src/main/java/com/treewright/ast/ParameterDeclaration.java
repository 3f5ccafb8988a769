package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

/**
 * A method or lambda parameter. Lambda parameters may omit the type.
 */
public final class ParameterDeclaration extends AstNode {

    public ParameterDeclaration() {
        super(NodeKind.PARAMETER_DECLARATION);
    }

    public SimpleType getType() {
        return getTypedChild(Roles.TYPE, SimpleType.class);
    }

    public void setType(SimpleType type) {
        setChildByRole(Roles.TYPE, type);
    }

    public TokenNode getNameToken() {
        return getTypedChild(Roles.IDENTIFIER, TokenNode.class);
    }

    public String getName() {
        return getTokenText(Roles.IDENTIFIER);
    }

    @Override
    protected AstNode newInstance() {
        return new ParameterDeclaration();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitParameterDeclaration(this, data);
    }
}
