package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

import java.util.List;

/**
 * A method: attributes, modifiers, return type, name, parameter list and either a body or a
 * terminating semicolon.
 */
public final class MethodDeclaration extends EntityDeclaration {

    public MethodDeclaration() {
        super(NodeKind.METHOD_DECLARATION);
    }

    public SimpleType getReturnType() {
        return getTypedChild(Roles.TYPE, SimpleType.class);
    }

    public void setReturnType(SimpleType type) {
        setChildByRole(Roles.TYPE, type);
    }

    public TokenNode getLParToken() {
        return getTypedChild(Roles.L_PAR, TokenNode.class);
    }

    public List<ParameterDeclaration> getParameters() {
        return getTypedChildren(Roles.PARAMETER, ParameterDeclaration.class);
    }

    public void setParameters(List<ParameterDeclaration> parameters) {
        setChildrenByRole(Roles.PARAMETER, parameters);
    }

    public TokenNode getRParToken() {
        return getTypedChild(Roles.R_PAR, TokenNode.class);
    }

    public BlockStatement getBody() {
        return getTypedChild(Roles.BODY, BlockStatement.class);
    }

    public void setBody(BlockStatement body) {
        setChildByRole(Roles.BODY, body);
    }

    public boolean hasBody() {
        return getChildByRole(Roles.BODY) != null;
    }

    @Override
    protected AstNode newInstance() {
        return new MethodDeclaration();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitMethodDeclaration(this, data);
    }
}
