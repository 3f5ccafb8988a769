package com.treewright.ast;

/**
 * Lexical category of a piece of trivia.
 */
public enum TriviaKind {
    WHITESPACE,
    END_OF_LINE,
    SINGLE_LINE_COMMENT,
    MULTI_LINE_COMMENT,
    DIRECTIVE;

    public boolean isComment() {
        return this == SINGLE_LINE_COMMENT || this == MULTI_LINE_COMMENT;
    }

    public boolean isWhitespace() {
        return this == WHITESPACE || this == END_OF_LINE;
    }
}
