package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

/**
 * Integer, string, boolean or null literal.
 */
public final class PrimitiveExpression extends Expression {

    public PrimitiveExpression() {
        super(NodeKind.PRIMITIVE_EXPRESSION);
    }

    public TokenNode getLiteralToken() {
        return getTypedChild(Roles.LITERAL, TokenNode.class);
    }

    /**
     * Literal exactly as written, quotes included for strings.
     */
    public String getLiteralText() {
        return getTokenText(Roles.LITERAL);
    }

    /**
     * Decoded value: an {@link Long}, a {@link String} without quotes, a {@link Boolean}, or null.
     */
    public Object getValue() {
        TokenNode token = getLiteralToken();
        if (token == null) {
            return null;
        }
        String text = token.getText();
        return switch (token.getTokenKind()) {
            case INTEGER_LITERAL -> Long.parseLong(text);
            case STRING_LITERAL -> text.length() >= 2 ? text.substring(1, text.length() - 1) : text;
            case KEYWORD -> "true".equals(text) ? Boolean.TRUE : "false".equals(text) ? Boolean.FALSE : null;
            default -> null;
        };
    }

    @Override
    protected AstNode newInstance() {
        return new PrimitiveExpression();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitPrimitiveExpression(this, data);
    }
}
