package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

import java.util.List;

/**
 * {@code x => body} or {@code (a, b) => body}. The body is either an expression or a block.
 */
public final class LambdaExpression extends Expression {

    public LambdaExpression() {
        super(NodeKind.LAMBDA_EXPRESSION);
    }

    public List<ParameterDeclaration> getParameters() {
        return getTypedChildren(Roles.PARAMETER, ParameterDeclaration.class);
    }

    public boolean hasParentheses() {
        return getChildByRole(Roles.L_PAR) != null;
    }

    public TokenNode getArrowToken() {
        return getTypedChild(Roles.ARROW, TokenNode.class);
    }

    public AstNode getBody() {
        return getChildByRole(Roles.LAMBDA_BODY);
    }

    public void setBody(AstNode body) {
        setChildByRole(Roles.LAMBDA_BODY, body);
    }

    public boolean hasBlockBody() {
        return getBody() instanceof BlockStatement;
    }

    @Override
    protected AstNode newInstance() {
        return new LambdaExpression();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitLambdaExpression(this, data);
    }
}
