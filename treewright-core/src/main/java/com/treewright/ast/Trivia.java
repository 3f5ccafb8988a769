package com.treewright.ast;

import java.util.List;
import java.util.Objects;

/**
 * Non-semantic text attached to a token: whitespace, line breaks, comments or directives.
 */
public record Trivia(TriviaKind kind, String text) {

    public Trivia {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static Trivia whitespace(String text) {
        return new Trivia(TriviaKind.WHITESPACE, text);
    }

    public static Trivia space() {
        return new Trivia(TriviaKind.WHITESPACE, " ");
    }

    public static Trivia endOfLine() {
        return new Trivia(TriviaKind.END_OF_LINE, "\n");
    }

    public static Trivia comment(String text) {
        return new Trivia(text.startsWith("/*") ? TriviaKind.MULTI_LINE_COMMENT : TriviaKind.SINGLE_LINE_COMMENT, text);
    }

    public static String toText(List<Trivia> trivia) {
        StringBuilder sb = new StringBuilder();
        for (Trivia t : trivia) {
            sb.append(t.text());
        }
        return sb.toString();
    }

    public static boolean hasComment(List<Trivia> trivia) {
        for (Trivia t : trivia) {
            if (t.kind().isComment()) {
                return true;
            }
        }
        return false;
    }
}
