package com.treewright.ast;

import com.treewright.parser.SourcePrinter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable snapshot of a parsed or rewritten document.
 *
 * <p>Creating a snapshot freezes the root and indexes every node's parent, which is how parent
 * and ancestor lookups work without a back-reference on the nodes themselves. Rewriting a tree
 * produces a new snapshot; this one stays valid and is safe to read from any number of
 * threads.</p>
 */
public final class SyntaxTree {

    private final AstNode root;
    private final List<ParseDiagnostic> diagnostics;
    private final Map<AstNode, AstNode> parents = new IdentityHashMap<>();

    public SyntaxTree(AstNode root) {
        this(root, List.of());
    }

    public SyntaxTree(AstNode root, List<ParseDiagnostic> diagnostics) {
        this.root = Objects.requireNonNull(root, "root");
        this.diagnostics = List.copyOf(diagnostics);
        root.freeze();
        index(root);
    }

    private void index(AstNode node) {
        for (Attachment attachment : node.getAttachments()) {
            AstNode child = attachment.node();
            if (child == root || parents.put(child, node) != null) {
                throw new IllegalStateException(child.getKind().displayName()
                    + " occurs twice in the tree; clone shared subtrees before building a SyntaxTree");
            }
            index(child);
        }
    }

    public AstNode getRoot() {
        return root;
    }

    public List<ParseDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    public boolean contains(AstNode node) {
        return node == root || parents.containsKey(node);
    }

    /**
     * Parent of {@code node} in this snapshot, or null for the root or a node outside the tree.
     */
    public AstNode getParent(AstNode node) {
        return parents.get(node);
    }

    /**
     * Ancestors of {@code node}, nearest first.
     */
    public List<AstNode> ancestors(AstNode node) {
        List<AstNode> result = new ArrayList<>();
        AstNode current = parents.get(node);
        while (current != null) {
            result.add(current);
            current = parents.get(current);
        }
        return result;
    }

    /**
     * Nearest ancestor of {@code node} (the node itself included) that is an instance of
     * {@code type}, or null.
     */
    public <N extends AstNode> N findEnclosing(AstNode node, Class<N> type) {
        AstNode current = node;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = parents.get(current);
        }
        return null;
    }

    public NodePath pathOf(AstNode node) {
        if (!contains(node)) {
            throw new IllegalArgumentException(node + " is not part of this tree");
        }
        List<NodePath.Step> steps = new ArrayList<>();
        AstNode current = node;
        AstNode parent = parents.get(current);
        while (parent != null) {
            int index = parent.indexOfChild(current);
            steps.add(new NodePath.Step(parent.getAttachments().get(index).role(), index));
            current = parent;
            parent = parents.get(current);
        }
        Collections.reverse(steps);
        return new NodePath(steps);
    }

    public AstNode nodeAt(NodePath path) {
        return path.resolve(root);
    }

    /**
     * Token under the caret at {@code offset}. When the caret sits right after a token and
     * before whitespace, that preceding token is returned. Returns null if no lexed token is
     * near the offset.
     */
    public TokenNode findTokenAt(int offset) {
        TokenNode touching = null;
        for (TokenNode token : root.getTokens()) {
            Token t = token.getToken();
            if (t.isSynthesized() || t.kind() == TokenKind.END_OF_FILE) {
                continue;
            }
            if (t.offset() <= offset && offset < t.end()) {
                return token;
            }
            if (t.end() == offset) {
                touching = token;
            }
        }
        return touching;
    }

    /**
     * The document text, reproduced from tokens and trivia.
     */
    public String getText() {
        return SourcePrinter.print(root);
    }

    @Override
    public String toString() {
        return getText();
    }
}
