package com.treewright.parser;

import com.treewright.ast.ParseDiagnostic;
import com.treewright.ast.Token;
import com.treewright.ast.TokenKind;
import com.treewright.ast.Trivia;
import com.treewright.ast.TriviaKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits source text into tokens and attaches every character that is not part of a token to a
 * neighbouring token as trivia.
 *
 * <p>A token's trailing trivia runs up to and including the first line break after it; all other
 * trivia becomes leading trivia of the next token. Trivia after the last token belongs to the
 * END_OF_FILE token. Lines starting with {@code #} are DIRECTIVE trivia. The lexer never throws:
 * unterminated strings and comments and unknown characters become BAD tokens and are reported
 * through {@link #getDiagnostics()}.</p>
 */
public final class Lexer {

    static final Set<String> MODIFIERS = Set.of(
        "public", "private", "protected", "internal", "static", "virtual", "override", "abstract", "sealed",
        "final", "readonly");

    private static final Set<String> KEYWORDS;

    static {
        Set<String> keywords = new HashSet<>(MODIFIERS);
        keywords.addAll(List.of("class", "if", "else", "while", "do", "return", "true", "false", "null"));
        KEYWORDS = Set.copyOf(keywords);
    }

    // Longest first
    private static final String[] OPERATORS = {
        "=>", "==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=",
        "+", "-", "*", "/", "%", "<", ">", "=", "!"
    };

    private static final String PUNCTUATION = "(){};,.@";

    private final String source;
    private final List<ParseDiagnostic> diagnostics = new ArrayList<>();
    private int pos;

    public Lexer(String source) {
        this.source = source;
    }

    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }

    public static boolean isModifier(String text) {
        return MODIFIERS.contains(text);
    }

    /**
     * Tokenizes the whole source. The last token is always END_OF_FILE.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        pos = 0;
        List<Trivia> leading = scanLeadingTrivia();
        while (pos < source.length()) {
            int start = pos;
            TokenKind kind = scanToken();
            String text = source.substring(start, pos);
            List<Trivia> trailing = scanTrailingTrivia();
            tokens.add(new Token(kind, text, start, leading, trailing));
            leading = scanLeadingTrivia();
        }
        tokens.add(new Token(TokenKind.END_OF_FILE, "", source.length(), leading, List.of()));
        return tokens;
    }

    public List<ParseDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    private TokenKind scanToken() {
        char c = source.charAt(pos);
        if (Character.isLetter(c) || c == '_') {
            int start = pos;
            while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            String word = source.substring(start, pos);
            return KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER;
        }
        if (Character.isDigit(c)) {
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
            return TokenKind.INTEGER_LITERAL;
        }
        if (c == '"') {
            return scanString();
        }
        if (source.startsWith("/*", pos)) {
            // Only reached for an unterminated comment; terminated ones are trivia
            diagnostics.add(new ParseDiagnostic("Unterminated comment", pos, source.length() - pos));
            pos = source.length();
            return TokenKind.BAD;
        }
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                pos += op.length();
                return TokenKind.OPERATOR;
            }
        }
        if (PUNCTUATION.indexOf(c) >= 0) {
            pos++;
            return TokenKind.PUNCTUATION;
        }
        diagnostics.add(new ParseDiagnostic("Unexpected character '" + c + "'", pos, 1));
        pos++;
        return TokenKind.BAD;
    }

    private TokenKind scanString() {
        int start = pos;
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length() && source.charAt(pos + 1) != '\n') {
                pos += 2;
            } else if (c == '"') {
                pos++;
                return TokenKind.STRING_LITERAL;
            } else if (c == '\n' || c == '\r') {
                break;
            } else {
                pos++;
            }
        }
        diagnostics.add(new ParseDiagnostic("Unterminated string literal", start, pos - start));
        return TokenKind.BAD;
    }

    private List<Trivia> scanTrailingTrivia() {
        List<Trivia> trivia = new ArrayList<>();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t') {
                trivia.add(scanWhitespace());
            } else if (c == '\n' || c == '\r') {
                trivia.add(scanEndOfLine());
                break;
            } else if (source.startsWith("//", pos)) {
                trivia.add(scanSingleLineComment());
            } else if (source.startsWith("/*", pos) && source.indexOf("*/", pos + 2) >= 0) {
                trivia.add(scanMultiLineComment());
            } else {
                break;
            }
        }
        return trivia;
    }

    private List<Trivia> scanLeadingTrivia() {
        List<Trivia> trivia = new ArrayList<>();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t') {
                trivia.add(scanWhitespace());
            } else if (c == '\n' || c == '\r') {
                trivia.add(scanEndOfLine());
            } else if (source.startsWith("//", pos)) {
                trivia.add(scanSingleLineComment());
            } else if (source.startsWith("/*", pos) && source.indexOf("*/", pos + 2) >= 0) {
                trivia.add(scanMultiLineComment());
            } else if (c == '#' && atLineStart()) {
                int start = pos;
                skipToLineEnd();
                trivia.add(new Trivia(TriviaKind.DIRECTIVE, source.substring(start, pos)));
            } else {
                break;
            }
        }
        return trivia;
    }

    private Trivia scanWhitespace() {
        int start = pos;
        while (pos < source.length() && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) {
            pos++;
        }
        return new Trivia(TriviaKind.WHITESPACE, source.substring(start, pos));
    }

    private Trivia scanEndOfLine() {
        int start = pos;
        if (source.startsWith("\r\n", pos)) {
            pos += 2;
        } else {
            pos++;
        }
        return new Trivia(TriviaKind.END_OF_LINE, source.substring(start, pos));
    }

    private Trivia scanSingleLineComment() {
        int start = pos;
        skipToLineEnd();
        return new Trivia(TriviaKind.SINGLE_LINE_COMMENT, source.substring(start, pos));
    }

    private Trivia scanMultiLineComment() {
        int start = pos;
        pos = source.indexOf("*/", pos + 2) + 2;
        return new Trivia(TriviaKind.MULTI_LINE_COMMENT, source.substring(start, pos));
    }

    private void skipToLineEnd() {
        while (pos < source.length() && source.charAt(pos) != '\n' && source.charAt(pos) != '\r') {
            pos++;
        }
    }

    private boolean atLineStart() {
        int i = pos - 1;
        while (i >= 0 && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
            i--;
        }
        return i < 0 || source.charAt(i) == '\n' || source.charAt(i) == '\r';
    }
}
