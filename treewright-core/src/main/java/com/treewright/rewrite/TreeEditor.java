package com.treewright.rewrite;

import com.treewright.ast.AstNode;
import com.treewright.ast.Attachment;
import com.treewright.ast.NodePath;
import com.treewright.ast.ParseDiagnostic;
import com.treewright.ast.SyntaxTree;
import com.treewright.ast.TextSpan;
import com.treewright.ast.Token;
import com.treewright.ast.TokenNode;
import com.treewright.ast.Trivia;
import com.treewright.pattern.PatternMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Applies {@link Edit}s to a {@link SyntaxTree} by persistent update.
 *
 * <p>Only the spine from each edit point up to the root is rebuilt; every untouched subtree of
 * the input tree is shared with the result. The input tree is never modified and stays valid.</p>
 *
 * <p>A batch is validated completely before anything is rebuilt: targets must resolve,
 * preconditions must still match and no two edits may overlap. Edits are then applied from the
 * last document position to the first, so applying them never shifts a position another edit of
 * the batch still needs.</p>
 */
public final class TreeEditor {

    private static final Logger LOG = Logger.getLogger(TreeEditor.class.getName());

    private final RewriteOptions options;

    public TreeEditor() {
        this(RewriteOptions.defaults());
    }

    public TreeEditor(RewriteOptions options) {
        this.options = options == null ? RewriteOptions.defaults() : options;
    }

    public RewriteOptions getOptions() {
        return options;
    }

    public SyntaxTree apply(SyntaxTree tree, Edit edit) {
        return applyEdits(tree, List.of(edit));
    }

    /**
     * Applies a batch of edits, independent of the order they are given in.
     *
     * @throws ConflictingEditException if two edits overlap
     * @throws StaleEditException       if an edit's target or precondition no longer holds
     */
    public SyntaxTree applyEdits(SyntaxTree tree, List<Edit> edits) {
        if (edits.isEmpty()) {
            return tree;
        }
        List<Resolved> resolved = new ArrayList<>(edits.size());
        for (Edit edit : edits) {
            resolved.add(resolve(tree, edit));
        }
        checkConflicts(resolved);

        resolved.sort(Comparator.comparing((Resolved r) -> r.edit.getTarget()).reversed());
        List<AstNode> replacements = prepareReplacements(tree, resolved);

        AstNode root = tree.getRoot();
        for (int i = 0; i < resolved.size(); i++) {
            Resolved r = resolved.get(i);
            AstNode replacement = replacements.get(i);
            LOG.fine(() -> "Applying " + r.edit);
            if (replacement == null) {
                root = removeAt(root, r.edit.getTarget().steps(), 0);
            } else {
                root = replaceAt(root, r.edit.getTarget().steps(), 0, replacement);
            }
        }
        int count = resolved.size();
        LOG.fine(() -> "Applied " + count + " edit(s)");
        return new SyntaxTree(root, remainingDiagnostics(tree, resolved));
    }

    private Resolved resolve(SyntaxTree tree, Edit edit) {
        AstNode target = tree.nodeAt(edit.getTarget());
        if (target == null) {
            throw new StaleEditException("Edit target " + edit.getTarget() + " does not exist in the tree", edit);
        }
        if (edit.getPrecondition() != null && !PatternMatcher.match(edit.getPrecondition(), target).isSuccess()) {
            throw new StaleEditException("Precondition of edit at " + edit.getTarget() + " no longer matches "
                + target.getKind().displayName(), edit);
        }
        return new Resolved(edit, target, target.getSpan());
    }

    /**
     * Drops the diagnostics that fall inside an edited node. The rest keep their offsets into the
     * originally parsed text.
     */
    private static List<ParseDiagnostic> remainingDiagnostics(SyntaxTree tree, List<Resolved> resolved) {
        List<ParseDiagnostic> remaining = new ArrayList<>(tree.getDiagnostics().size());
        for (ParseDiagnostic diagnostic : tree.getDiagnostics()) {
            boolean replaced = false;
            for (Resolved r : resolved) {
                if (r.span != null && (r.span.contains(diagnostic.offset()) || r.span.overlapsWith(diagnostic.span()))) {
                    replaced = true;
                    break;
                }
            }
            if (!replaced) {
                remaining.add(diagnostic);
            }
        }
        return remaining;
    }

    /**
     * Targets are disjoint subtrees exactly when no path equals or contains another.
     */
    private static void checkConflicts(List<Resolved> resolved) {
        for (int i = 0; i < resolved.size(); i++) {
            for (int j = i + 1; j < resolved.size(); j++) {
                Resolved a = resolved.get(i);
                Resolved b = resolved.get(j);
                NodePath pa = a.edit.getTarget();
                NodePath pb = b.edit.getTarget();
                if (pa.equals(pb)) {
                    throw new ConflictingEditException("Two edits target " + pa, a.edit, b.edit);
                }
                if (pa.isAncestorOf(pb) || pb.isAncestorOf(pa)) {
                    throw new ConflictingEditException("Edit targets " + pa + " and " + pb + " are nested",
                        a.edit, b.edit);
                }
            }
        }
    }

    /**
     * Freezes each replacement, cloning it first when any of its nodes would otherwise occur twice
     * in the result, and applies the trivia policy. Null entries stand for removals.
     */
    private List<AstNode> prepareReplacements(SyntaxTree tree, List<Resolved> resolved) {
        Set<AstNode> released = identitySet();
        for (Resolved r : resolved) {
            collect(r.target, released);
        }
        Set<AstNode> claimed = identitySet();
        List<AstNode> result = new ArrayList<>(resolved.size());
        for (Resolved r : resolved) {
            AstNode replacement = r.edit.getReplacement();
            if (replacement == null) {
                result.add(null);
                continue;
            }
            Set<AstNode> nodes = identitySet();
            collect(replacement, nodes);
            boolean aliased = false;
            for (AstNode node : nodes) {
                if (claimed.contains(node) || (tree.contains(node) && !released.contains(node))) {
                    aliased = true;
                    break;
                }
            }
            if (aliased) {
                String kind = replacement.getKind().displayName();
                LOG.fine(() -> "Cloning " + kind + " shared with another part of the tree");
                replacement = replacement.cloneSubtree();
                nodes.clear();
                collect(replacement, nodes);
            }
            claimed.addAll(nodes);
            replacement.freeze();
            result.add(transferTrivia(r, replacement));
        }
        return result;
    }

    private AstNode transferTrivia(Resolved r, AstNode replacement) {
        TokenNode removedFirst = r.target.getFirstToken();
        TokenNode removedLast = r.target.getLastToken();
        TokenNode first = replacement.getFirstToken();
        if (first == null || removedFirst == null) {
            return replacement;
        }
        List<Trivia> leading = r.edit.getLeadingTrivia() != null
            ? r.edit.getLeadingTrivia()
            : combineLeading(removedFirst.getToken().leadingTrivia(), first.getToken().leadingTrivia());
        AstNode result = updateFirstToken(replacement, token -> token.withLeadingTrivia(leading));

        TokenNode last = result.getLastToken();
        List<Trivia> trailing;
        if (r.edit.getTrailingTrivia() != null) {
            trailing = r.edit.getTrailingTrivia();
        } else if (options.inheritTrailingTrivia()) {
            trailing = combineTrailing(removedLast.getToken().trailingTrivia(), last.getToken().trailingTrivia());
        } else {
            return result;
        }
        return updateLastToken(result, token -> token.withTrailingTrivia(trailing));
    }

    private List<Trivia> combineLeading(List<Trivia> removed, List<Trivia> replacement) {
        return switch (options.triviaPrecedence()) {
            case REMOVED_NODE -> removed;
            case REPLACEMENT -> replacement.isEmpty() ? removed : replacement;
            case MERGE -> concat(removed, replacement);
        };
    }

    private List<Trivia> combineTrailing(List<Trivia> removed, List<Trivia> replacement) {
        return switch (options.triviaPrecedence()) {
            case REMOVED_NODE -> removed;
            case REPLACEMENT -> replacement.isEmpty() ? removed : replacement;
            case MERGE -> concat(replacement, removed);
        };
    }

    private static List<Trivia> concat(List<Trivia> a, List<Trivia> b) {
        List<Trivia> result = new ArrayList<>(a);
        result.addAll(b);
        return result;
    }

    private static AstNode updateFirstToken(AstNode node, UnaryOperator<Token> update) {
        if (node instanceof TokenNode tokenNode) {
            return frozen(tokenNode.withToken(update.apply(tokenNode.getToken())));
        }
        List<Attachment> attachments = node.getAttachments();
        for (int i = 0; i < attachments.size(); i++) {
            if (attachments.get(i).node().getFirstToken() != null) {
                return frozen(node.withAttachmentReplaced(i, updateFirstToken(attachments.get(i).node(), update)));
            }
        }
        return node;
    }

    private static AstNode updateLastToken(AstNode node, UnaryOperator<Token> update) {
        if (node instanceof TokenNode tokenNode) {
            return frozen(tokenNode.withToken(update.apply(tokenNode.getToken())));
        }
        List<Attachment> attachments = node.getAttachments();
        for (int i = attachments.size() - 1; i >= 0; i--) {
            if (attachments.get(i).node().getLastToken() != null) {
                return frozen(node.withAttachmentReplaced(i, updateLastToken(attachments.get(i).node(), update)));
            }
        }
        return node;
    }

    private static AstNode replaceAt(AstNode node, List<NodePath.Step> steps, int depth, AstNode replacement) {
        if (depth == steps.size()) {
            return replacement;
        }
        int index = steps.get(depth).index();
        AstNode child = node.getAttachments().get(index).node();
        return frozen(node.withAttachmentReplaced(index, replaceAt(child, steps, depth + 1, replacement)));
    }

    private static AstNode removeAt(AstNode node, List<NodePath.Step> steps, int depth) {
        int index = steps.get(depth).index();
        if (depth == steps.size() - 1) {
            return frozen(node.withAttachmentRemoved(index));
        }
        AstNode child = node.getAttachments().get(index).node();
        return frozen(node.withAttachmentReplaced(index, removeAt(child, steps, depth + 1)));
    }

    private static AstNode frozen(AstNode node) {
        node.freeze();
        return node;
    }

    private static void collect(AstNode node, Set<AstNode> into) {
        into.add(node);
        for (Attachment attachment : node.getAttachments()) {
            collect(attachment.node(), into);
        }
    }

    private static Set<AstNode> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private record Resolved(Edit edit, AstNode target, TextSpan span) {
    }
}
