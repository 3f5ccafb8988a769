package com.treewright.rewrite;

/**
 * Decides whose trivia ends up on a replacement's boundary tokens when both the removed node and
 * the replacement carry some.
 */
public enum TriviaPrecedence {
    /**
     * The removed node's trivia replaces the replacement's. Comments and indentation around the
     * edit point survive unchanged.
     */
    REMOVED_NODE,
    /**
     * The replacement keeps its own trivia when it has any, and inherits the removed node's
     * otherwise.
     */
    REPLACEMENT,
    /**
     * Removed node's trivia followed by the replacement's for leading trivia, the replacement's
     * followed by the removed node's for trailing trivia.
     */
    MERGE
}
