package com.treewright.rewrite;

import java.util.List;

/**
 * Tunables for rewriting and for the bundled rules.
 *
 * @param triviaPrecedence      how boundary trivia of removed node and replacement combine
 * @param inheritTrailingTrivia whether a replacement inherits the removed node's trailing trivia
 * @param testAttributeNames    attribute names that mark a method as a test
 */
public record RewriteOptions(
    TriviaPrecedence triviaPrecedence,
    boolean inheritTrailingTrivia,
    List<String> testAttributeNames
) {
    public static final List<String> DEFAULT_TEST_ATTRIBUTES = List.of("Test", "TestCase", "Fact");

    public RewriteOptions {
        triviaPrecedence = triviaPrecedence == null ? TriviaPrecedence.REMOVED_NODE : triviaPrecedence;
        testAttributeNames = testAttributeNames == null ? DEFAULT_TEST_ATTRIBUTES : List.copyOf(testAttributeNames);
    }

    public static RewriteOptions defaults() {
        return new RewriteOptions(TriviaPrecedence.REMOVED_NODE, true, DEFAULT_TEST_ATTRIBUTES);
    }

    public RewriteOptions withTriviaPrecedence(TriviaPrecedence precedence) {
        return new RewriteOptions(precedence, inheritTrailingTrivia, testAttributeNames);
    }

    public RewriteOptions withInheritTrailingTrivia(boolean inherit) {
        return new RewriteOptions(triviaPrecedence, inherit, testAttributeNames);
    }

    public RewriteOptions withTestAttributeNames(List<String> names) {
        return new RewriteOptions(triviaPrecedence, inheritTrailingTrivia, names);
    }

    public boolean isTestAttribute(String name) {
        return name != null && testAttributeNames.contains(name);
    }
}
