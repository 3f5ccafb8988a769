package com.treewright.refactoring;

import com.treewright.ast.AstNode;
import com.treewright.ast.SyntaxTree;
import com.treewright.ast.TokenNode;
import com.treewright.rewrite.RewriteOptions;
import com.treewright.rewrite.TreeEditor;
import com.treewright.semantics.SymbolResolver;
import com.treewright.visitor.CancellationToken;

import java.util.Objects;

/**
 * Everything a rule gets to look at: the tree, the caret offset (or {@code -1} when a whole
 * document is analyzed), an optional semantic model and the rewrite options.
 */
public final class RefactoringContext {

    private final SyntaxTree tree;
    private final int offset;
    private final CancellationToken cancellation;
    private final SymbolResolver resolver;
    private final RewriteOptions options;

    public RefactoringContext(SyntaxTree tree, int offset, CancellationToken cancellation, SymbolResolver resolver,
                              RewriteOptions options) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.offset = offset;
        this.cancellation = cancellation == null ? CancellationToken.NONE : cancellation;
        this.resolver = resolver == null ? SymbolResolver.NONE : resolver;
        this.options = options == null ? RewriteOptions.defaults() : options;
    }

    public static RefactoringContext atOffset(SyntaxTree tree, int offset) {
        return new RefactoringContext(tree, offset, CancellationToken.NONE, SymbolResolver.NONE, RewriteOptions.defaults());
    }

    public static RefactoringContext forDocument(SyntaxTree tree) {
        return atOffset(tree, -1);
    }

    public SyntaxTree getTree() {
        return tree;
    }

    public int getOffset() {
        return offset;
    }

    public CancellationToken getCancellation() {
        return cancellation;
    }

    public SymbolResolver getResolver() {
        return resolver;
    }

    public RewriteOptions getOptions() {
        return options;
    }

    public TreeEditor newEditor() {
        return new TreeEditor(options);
    }

    /**
     * Token under the caret, or null when there is no caret or no token there.
     */
    public TokenNode getTokenAtCaret() {
        return offset < 0 ? null : tree.findTokenAt(offset);
    }

    /**
     * Nearest node of {@code type} enclosing the caret token, or null.
     */
    public <N extends AstNode> N getNodeAtCaret(Class<N> type) {
        TokenNode token = getTokenAtCaret();
        return token == null ? null : tree.findEnclosing(token, type);
    }
}
