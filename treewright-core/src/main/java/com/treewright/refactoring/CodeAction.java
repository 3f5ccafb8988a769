package com.treewright.refactoring;

import com.treewright.ast.SyntaxTree;
import com.treewright.rewrite.Edit;
import com.treewright.rewrite.TreeEditor;

import java.util.List;
import java.util.Objects;

/**
 * A titled, not yet applied change to one tree. Applying it returns a new tree and leaves the
 * original untouched, so an action can be previewed and discarded.
 */
public final class CodeAction {

    private final String title;
    private final SyntaxTree tree;
    private final List<Edit> edits;
    private final TreeEditor editor;

    public CodeAction(String title, SyntaxTree tree, List<Edit> edits, TreeEditor editor) {
        this.title = Objects.requireNonNull(title, "title");
        this.tree = Objects.requireNonNull(tree, "tree");
        this.edits = List.copyOf(edits);
        this.editor = editor == null ? new TreeEditor() : editor;
    }

    public String getTitle() {
        return title;
    }

    public List<Edit> getEdits() {
        return edits;
    }

    public SyntaxTree apply() {
        return editor.applyEdits(tree, edits);
    }

    @Override
    public String toString() {
        return title;
    }
}
