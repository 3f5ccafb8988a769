package com.treewright.rewrite;

import com.treewright.ast.AstNode;
import com.treewright.ast.NodePath;
import com.treewright.ast.SyntaxTree;
import com.treewright.ast.Trivia;

import java.util.List;
import java.util.Objects;

/**
 * One change to a tree: replace or remove the node at a path.
 *
 * <p>Edits name their target by position, not by value, so they stay unambiguous when the tree
 * holds several structurally equal subtrees. Edits are immutable; the {@code with*} methods and
 * {@link #when(AstNode)} return modified copies.</p>
 */
public final class Edit {

    private final NodePath target;
    private final AstNode replacement;
    private final List<Trivia> leadingTrivia;
    private final List<Trivia> trailingTrivia;
    private final AstNode precondition;

    private Edit(NodePath target, AstNode replacement, List<Trivia> leadingTrivia, List<Trivia> trailingTrivia,
                 AstNode precondition) {
        this.target = Objects.requireNonNull(target, "target");
        this.replacement = replacement;
        this.leadingTrivia = leadingTrivia == null ? null : List.copyOf(leadingTrivia);
        this.trailingTrivia = trailingTrivia == null ? null : List.copyOf(trailingTrivia);
        this.precondition = precondition;
    }

    /**
     * Replaces the node at {@code target}. The replacement is frozen when the edit is applied.
     */
    public static Edit replace(NodePath target, AstNode replacement) {
        return new Edit(target, Objects.requireNonNull(replacement, "replacement"), null, null, null);
    }

    public static Edit replace(SyntaxTree tree, AstNode target, AstNode replacement) {
        return replace(tree.pathOf(target), replacement);
    }

    /**
     * Removes the node at {@code target} together with its trivia.
     */
    public static Edit remove(NodePath target) {
        if (target.isRoot()) {
            throw new IllegalArgumentException("The root cannot be removed");
        }
        return new Edit(target, null, null, null, null);
    }

    public static Edit remove(SyntaxTree tree, AstNode target) {
        return remove(tree.pathOf(target));
    }

    /**
     * Leading trivia for the replacement's first token, overriding the inherited trivia.
     */
    public Edit withLeadingTrivia(List<Trivia> trivia) {
        checkReplacement();
        return new Edit(target, replacement, Objects.requireNonNull(trivia, "trivia"), trailingTrivia, precondition);
    }

    /**
     * Trailing trivia for the replacement's last token, overriding the inherited trivia.
     */
    public Edit withTrailingTrivia(List<Trivia> trivia) {
        checkReplacement();
        return new Edit(target, replacement, leadingTrivia, Objects.requireNonNull(trivia, "trivia"), precondition);
    }

    /**
     * Requires the target to still match {@code pattern} when the edit is applied.
     */
    public Edit when(AstNode pattern) {
        return new Edit(target, replacement, leadingTrivia, trailingTrivia, Objects.requireNonNull(pattern, "pattern"));
    }

    private void checkReplacement() {
        if (replacement == null) {
            throw new IllegalStateException("A removal has no replacement to carry trivia");
        }
    }

    public NodePath getTarget() {
        return target;
    }

    /**
     * The replacement node, or null for a removal.
     */
    public AstNode getReplacement() {
        return replacement;
    }

    public boolean isRemoval() {
        return replacement == null;
    }

    /**
     * Explicit leading trivia, or null to inherit it from the removed node.
     */
    public List<Trivia> getLeadingTrivia() {
        return leadingTrivia;
    }

    public List<Trivia> getTrailingTrivia() {
        return trailingTrivia;
    }

    public AstNode getPrecondition() {
        return precondition;
    }

    @Override
    public String toString() {
        return (isRemoval() ? "remove " : "replace ") + target
            + (isRemoval() ? "" : " with " + replacement.getKind().displayName());
    }
}
