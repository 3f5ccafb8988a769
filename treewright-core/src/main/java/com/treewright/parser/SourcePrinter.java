package com.treewright.parser;

import com.treewright.ast.AstNode;
import com.treewright.ast.Token;
import com.treewright.ast.TokenNode;
import com.treewright.ast.Trivia;
import com.treewright.pattern.AnyNode;
import com.treewright.pattern.Repeat;
import com.treewright.visitor.DepthFirstAstVisitor;

/**
 * Turns a tree back into text. Each token is written with its leading trivia, its text and its
 * trailing trivia, so a freshly parsed tree prints as exactly the source it came from.
 *
 * <p>Pattern placeholders print as {@code $name} and {@code $name...}, which is only meant for
 * diagnostics.</p>
 */
public final class SourcePrinter extends DepthFirstAstVisitor<StringBuilder, Void> {

    private static final SourcePrinter INSTANCE = new SourcePrinter();

    private SourcePrinter() {
    }

    public static String print(AstNode node) {
        StringBuilder out = new StringBuilder();
        node.acceptVisitor(INSTANCE, out);
        return out.toString();
    }

    @Override
    public Void visitToken(TokenNode tokenNode, StringBuilder out) {
        Token token = tokenNode.getToken();
        for (Trivia trivia : token.leadingTrivia()) {
            out.append(trivia.text());
        }
        out.append(token.text());
        for (Trivia trivia : token.trailingTrivia()) {
            out.append(trivia.text());
        }
        return null;
    }

    @Override
    public Void visitAnyNode(AnyNode anyNode, StringBuilder out) {
        out.append('$').append(anyNode.getName() != null ? anyNode.getName() : "_");
        return null;
    }

    @Override
    public Void visitRepeat(Repeat repeat, StringBuilder out) {
        out.append('$').append(repeat.getName() != null ? repeat.getName() : "_").append("...");
        return null;
    }
}
