package com.treewright.json;

import com.treewright.ast.AstNode;
import com.treewright.ast.SyntaxTree;

/**
 * Writes a subtree as JSON. Each node is written as its kind and its children in canonical role
 * order, each token with its text, offset and leading and trailing trivia, so nothing of the
 * source text is lost. Frozen and unfrozen nodes are written alike.
 */
public interface AstJsonSerializer {

    /**
     * Compact JSON for {@code node} and everything below it.
     */
    String serialize(AstNode node) throws AstJsonException;

    /**
     * Same content as {@link #serialize(AstNode)}, indented for reading.
     */
    String serializePretty(AstNode node) throws AstJsonException;

    default String serialize(SyntaxTree tree) throws AstJsonException {
        return serialize(tree.getRoot());
    }
}
