package com.treewright.ast;

/**
 * Coarse grouping of node kinds. Roles constrain their children by category.
 */
public enum NodeCategory {
    DECLARATION,
    STATEMENT,
    EXPRESSION,
    TYPE,
    TOKEN,
    OTHER,
    // Placeholder produced for malformed source regions
    ERROR,
    // Wildcards used in pattern trees
    PATTERN,
    // Only valid as a role constraint
    ANY;

    /**
     * Whether a child of category {@code actual} may be attached under a role expecting this category.
     */
    public boolean accepts(NodeCategory actual) {
        return this == ANY || this == actual || actual == ERROR || actual == PATTERN;
    }
}
