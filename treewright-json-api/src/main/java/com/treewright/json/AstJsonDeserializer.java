package com.treewright.json;

import com.treewright.ast.AstNode;
import com.treewright.ast.SyntaxTree;

/**
 * Rebuilds nodes from the JSON an {@link AstJsonSerializer} wrote. Tokens come back with their
 * offsets and trivia, so {@code SourcePrinter.print} of the result reproduces the text the
 * serialized tree printed. Pattern placeholders are restored as placeholders.
 */
public interface AstJsonDeserializer {

    /**
     * Reads a whole tree and indexes it as a frozen {@link SyntaxTree}. Parse diagnostics are
     * not part of the JSON, so the result reports none.
     *
     * @throws AstJsonException if the JSON is malformed, names an unknown kind or role, or a node
     *                          appears under a role its parent does not declare
     */
    SyntaxTree deserializeTree(String json) throws AstJsonException;

    /**
     * Reads a detached, unfrozen node, ready to be used as an edit replacement or a pattern.
     *
     * @throws AstJsonException if reading fails or the root node is not a {@code type}
     */
    <T extends AstNode> T deserialize(String json, Class<T> type) throws AstJsonException;
}
