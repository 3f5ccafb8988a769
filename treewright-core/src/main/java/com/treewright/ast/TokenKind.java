package com.treewright.ast;

/**
 * Lexical category of a token.
 */
public enum TokenKind {
    IDENTIFIER,
    KEYWORD,
    INTEGER_LITERAL,
    STRING_LITERAL,
    OPERATOR,
    PUNCTUATION,
    END_OF_FILE,
    // Unterminated strings/comments and stray characters
    BAD
}
