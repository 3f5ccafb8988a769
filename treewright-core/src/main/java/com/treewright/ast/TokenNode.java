package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * Leaf node wrapping a single {@link Token}. Keywords, punctuation, identifiers and literals all
 * appear in the tree as token nodes so that printing can reproduce every character of the source.
 */
public final class TokenNode extends AstNode {

    private final Token token;

    public TokenNode(Token token) {
        super(NodeKind.TOKEN);
        this.token = Objects.requireNonNull(token, "token");
    }

    /**
     * Creates a synthesized token node without trivia.
     */
    public static TokenNode of(TokenKind kind, String text) {
        return new TokenNode(new Token(kind, text));
    }

    static TokenNode separator(Role listRole) {
        String text = listRole.getSeparatorText() != null ? listRole.getSeparatorText() : ",";
        return new TokenNode(new Token(TokenKind.PUNCTUATION, text, -1, List.of(), List.of(Trivia.space())));
    }

    public Token getToken() {
        return token;
    }

    public String getText() {
        return token.text();
    }

    public TokenKind getTokenKind() {
        return token.kind();
    }

    /**
     * Returns a new, unfrozen token node holding {@code newToken}.
     */
    public TokenNode withToken(Token newToken) {
        return new TokenNode(newToken);
    }

    @Override
    public TokenNode getFirstToken() {
        return this;
    }

    @Override
    public TokenNode getLastToken() {
        return this;
    }

    @Override
    protected boolean leafEquals(AstNode other) {
        Token o = ((TokenNode) other).token;
        return token.kind() == o.kind() && token.text().equals(o.text());
    }

    @Override
    protected int leafHashCode() {
        return token.kind().hashCode() * 31 + token.text().hashCode();
    }

    @Override
    protected AstNode newInstance() {
        return new TokenNode(token);
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitToken(this, data);
    }

    @Override
    public String toString() {
        return "Token(" + token.kind() + " '" + token.text() + "')";
    }
}
