package com.treewright.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Position of a node in a tree, as the chain of attachment indices leading to it from the root.
 *
 * <p>Paths identify nodes by position rather than by value, so two structurally equal subtrees
 * at different places have different paths. Paths order nodes in document order: an ancestor
 * sorts before its descendants and siblings sort by attachment index.</p>
 */
public record NodePath(List<Step> steps) implements Comparable<NodePath> {

    public static final NodePath ROOT = new NodePath(List.of());

    /**
     * One hop from a parent to a child; {@code index} is the child's position among all of the
     * parent's attachments.
     */
    public record Step(Role role, int index) {
        public Step {
            Objects.requireNonNull(role, "role");
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative: " + index);
            }
        }

        @Override
        public String toString() {
            return role.getId() + "[" + index + "]";
        }
    }

    public NodePath {
        steps = List.copyOf(steps);
    }

    public int depth() {
        return steps.size();
    }

    public boolean isRoot() {
        return steps.isEmpty();
    }

    public Step lastStep() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("The root path has no steps");
        }
        return steps.get(steps.size() - 1);
    }

    public NodePath parent() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("The root path has no parent");
        }
        return new NodePath(steps.subList(0, steps.size() - 1));
    }

    public NodePath child(Role role, int index) {
        List<Step> extended = new ArrayList<>(steps);
        extended.add(new Step(role, index));
        return new NodePath(extended);
    }

    /**
     * True when this path is a proper prefix of {@code other}.
     */
    public boolean isAncestorOf(NodePath other) {
        if (other.steps.size() <= steps.size()) {
            return false;
        }
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).index() != other.steps.get(i).index()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Follows this path from {@code root}; returns null if any step is out of range or lands on
     * a different role.
     */
    public AstNode resolve(AstNode root) {
        AstNode current = root;
        for (Step step : steps) {
            List<Attachment> attachments = current.getAttachments();
            if (step.index() >= attachments.size()) {
                return null;
            }
            Attachment attachment = attachments.get(step.index());
            if (attachment.role() != step.role()) {
                return null;
            }
            current = attachment.node();
        }
        return current;
    }

    @Override
    public int compareTo(NodePath other) {
        int n = Math.min(steps.size(), other.steps.size());
        for (int i = 0; i < n; i++) {
            int cmp = Integer.compare(steps.get(i).index(), other.steps.get(i).index());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(steps.size(), other.steps.size());
    }

    @Override
    public String toString() {
        if (steps.isEmpty()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (Step step : steps) {
            sb.append('/').append(step);
        }
        return sb.toString();
    }
}
