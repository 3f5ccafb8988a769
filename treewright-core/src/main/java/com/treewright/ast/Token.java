package com.treewright.ast;

import java.util.List;
import java.util.Objects;

/**
 * An immutable lexical token with its surrounding trivia.
 *
 * <p>Tokens created programmatically (rather than lexed) have {@code offset == -1}.</p>
 */
public record Token(
    TokenKind kind,
    String text,
    int offset,
    List<Trivia> leadingTrivia,
    List<Trivia> trailingTrivia
) {
    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        leadingTrivia = leadingTrivia == null ? List.of() : List.copyOf(leadingTrivia);
        trailingTrivia = trailingTrivia == null ? List.of() : List.copyOf(trailingTrivia);
    }

    public Token(TokenKind kind, String text) {
        this(kind, text, -1, List.of(), List.of());
    }

    public int length() {
        return text.length();
    }

    public int end() {
        return offset < 0 ? -1 : offset + text.length();
    }

    public boolean isSynthesized() {
        return offset < 0;
    }

    public TextSpan span() {
        return offset < 0 ? null : new TextSpan(offset, end());
    }

    public Token withLeadingTrivia(List<Trivia> trivia) {
        return new Token(kind, text, offset, trivia, trailingTrivia);
    }

    public Token withTrailingTrivia(List<Trivia> trivia) {
        return new Token(kind, text, offset, leadingTrivia, trivia);
    }

    /**
     * Text including leading and trailing trivia, exactly as it appeared in the source.
     */
    public String fullText() {
        return Trivia.toText(leadingTrivia) + text + Trivia.toText(trailingTrivia);
    }
}
