package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for all nodes of the syntax tree.
 *
 * <p>A node owns an ordered list of {@link Attachment}s, each pairing a {@link Role} with a child.
 * Attachment order is source order. Which roles a node accepts is decided by its {@link NodeKind}
 * through the {@link RoleRegistry}; typed accessors on the subclasses are thin wrappers over
 * {@link #getChildByRole(Role)} and friends. Typed accessors return null when a slot is empty or
 * holds a placeholder (an {@link ErrorNode} or a pattern wildcard); use the role methods for raw
 * access.</p>
 *
 * <p>Nodes are mutable while a tree is being built and become immutable once frozen, which
 * happens when they are wrapped in a {@link SyntaxTree}. Frozen subtrees may be shared between
 * tree snapshots; the rewrite primitives {@link #withAttachmentReplaced} and
 * {@link #withAttachmentRemoved} return modified copies instead of changing the node. There is no
 * parent field: parent lookup goes through {@link SyntaxTree#getParent(AstNode)}.</p>
 */
public abstract class AstNode {

    private final NodeKind kind;
    private final List<Attachment> attachments = new ArrayList<>();
    private boolean frozen;
    // Owned by an unfrozen parent; frozen nodes never set this
    private boolean attached;

    protected AstNode(NodeKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public final NodeKind getKind() {
        return kind;
    }

    public final NodeCategory getCategory() {
        return kind.category();
    }

    public final boolean isFrozen() {
        return frozen;
    }

    /**
     * Child attachments in source order.
     */
    public final List<Attachment> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }

    public final List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(attachments.size());
        for (Attachment attachment : attachments) {
            children.add(attachment.node());
        }
        return children;
    }

    public final boolean hasChildren() {
        return !attachments.isEmpty();
    }

    /**
     * Returns the role under which {@code child} is attached, or null if it is not a direct child.
     */
    public final Role getRoleOf(AstNode child) {
        int index = indexOfChild(child);
        return index < 0 ? null : attachments.get(index).role();
    }

    public final int indexOfChild(AstNode child) {
        for (int i = 0; i < attachments.size(); i++) {
            if (attachments.get(i).node() == child) {
                return i;
            }
        }
        return -1;
    }

    // ==================== Role access ====================

    public final AstNode getChildByRole(Role role) {
        checkDeclared(role);
        if (role.isMany()) {
            throw new CardinalityException(role, "Role '" + role.getId() + "' holds many children; use getChildrenByRole");
        }
        for (Attachment attachment : attachments) {
            if (attachment.role() == role) {
                return attachment.node();
            }
        }
        return null;
    }

    /**
     * Children under {@code role} in source order. For a ONE role the list has at most one element.
     */
    public final List<AstNode> getChildrenByRole(Role role) {
        checkDeclared(role);
        List<AstNode> result = new ArrayList<>();
        for (Attachment attachment : attachments) {
            if (attachment.role() == role) {
                result.add(attachment.node());
            }
        }
        return result;
    }

    /**
     * Replaces the child under a ONE role; {@code null} clears the slot.
     */
    public final void setChildByRole(Role role, AstNode child) {
        checkMutable();
        checkDeclared(role);
        if (role.isMany()) {
            throw new CardinalityException(role, "Role '" + role.getId() + "' holds many children; use setChildrenByRole");
        }
        int existing = -1;
        for (int i = 0; i < attachments.size(); i++) {
            if (attachments.get(i).role() == role) {
                existing = i;
                break;
            }
        }
        if (child == null) {
            if (existing >= 0) {
                detach(attachments.remove(existing).node());
            }
            return;
        }
        if (existing >= 0 && attachments.get(existing).node() == child) {
            return;
        }
        prepareAttach(role, child);
        if (existing >= 0) {
            detach(attachments.set(existing, new Attachment(role, child)).node());
        } else {
            attachments.add(canonicalInsertionIndex(role), new Attachment(role, child));
        }
    }

    /**
     * Replaces every child under a MANY role; an empty list clears it. Separator tokens between the
     * elements are regenerated.
     */
    public final void setChildrenByRole(Role role, List<? extends AstNode> children) {
        checkMutable();
        checkDeclared(role);
        if (!role.isMany()) {
            throw new CardinalityException(role, "Role '" + role.getId() + "' holds at most one child; use setChildByRole");
        }
        Role separator = role.getSeparator();
        // Validate everything up front so a rejected child leaves the node untouched
        Set<AstNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (AstNode child : children) {
            Objects.requireNonNull(child, "children must not contain null");
            if (!seen.add(child)) {
                throw new IllegalArgumentException(child.kind.displayName() + " appears twice in the new children");
            }
            checkCategory(role, child);
            if (!child.frozen && child.attached && child.getRoleOfAttachedIn(this) != role) {
                throw new IllegalArgumentException(child.kind.displayName()
                    + " is already attached to a parent; clone it with cloneSubtree() before attaching it elsewhere");
            }
        }
        int insertAt = -1;
        for (int i = attachments.size() - 1; i >= 0; i--) {
            Role r = attachments.get(i).role();
            if (r == role || (separator != null && r == separator)) {
                insertAt = i;
                detach(attachments.remove(i).node());
            }
        }
        if (insertAt < 0) {
            insertAt = canonicalInsertionIndex(role);
        }
        List<Attachment> added = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            if (i > 0 && separator != null) {
                added.add(new Attachment(separator, TokenNode.separator(role)));
            }
            AstNode child = children.get(i);
            prepareAttach(role, child);
            added.add(new Attachment(role, child));
        }
        attachments.addAll(insertAt, added);
    }

    /**
     * Attaches {@code child} under {@code role} at the role's position. Under a MANY role the child
     * is appended after existing children of that role; under a ONE role it replaces the current
     * child.
     */
    public final void addChild(Role role, AstNode child) {
        Objects.requireNonNull(child, "child");
        if (!role.isMany()) {
            setChildByRole(role, child);
            return;
        }
        checkMutable();
        checkDeclared(role);
        prepareAttach(role, child);
        attachments.add(canonicalInsertionIndex(role), new Attachment(role, child));
    }

    /**
     * Detaches a direct child. Returns false when {@code child} is not a child of this node.
     */
    public final boolean removeChild(AstNode child) {
        checkMutable();
        int index = indexOfChild(child);
        if (index < 0) {
            return false;
        }
        detach(attachments.remove(index).node());
        return true;
    }

    private int canonicalInsertionIndex(Role role) {
        RoleRegistry registry = Roles.registry();
        int rank = registry.rankOf(kind, role);
        int index = 0;
        for (int i = 0; i < attachments.size(); i++) {
            if (registry.rankOf(kind, attachments.get(i).role()) <= rank) {
                index = i + 1;
            }
        }
        return index;
    }

    private void checkDeclared(Role role) {
        Objects.requireNonNull(role, "role");
        if (!Roles.registry().isDeclared(kind, role)) {
            throw new InvalidRoleException(kind, role);
        }
    }

    private void checkCategory(Role role, AstNode child) {
        if (!role.getCategory().accepts(child.getCategory())) {
            throw new InvalidRoleException(kind, role, "Role '" + role.getId() + "' of " + kind.displayName()
                + " expects " + role.getCategory() + " but got " + child.getKind().displayName());
        }
        if (child.getKind() == NodeKind.REPEAT && !role.isMany()) {
            throw new CardinalityException(role, "Repeat placeholders may only appear under a MANY role, not '"
                + role.getId() + "'");
        }
    }

    private void prepareAttach(Role role, AstNode child) {
        checkCategory(role, child);
        if (child.frozen) {
            return;
        }
        if (child.attached) {
            throw new IllegalArgumentException(child.kind.displayName()
                + " is already attached to a parent; clone it with cloneSubtree() before attaching it elsewhere");
        }
        if (child == this || child.containsDescendant(this)) {
            throw new IllegalArgumentException("Attaching " + child.kind.displayName() + " would create a cycle");
        }
        child.attached = true;
    }

    private static void detach(AstNode child) {
        if (!child.frozen) {
            child.attached = false;
        }
    }

    private Role getRoleOfAttachedIn(AstNode parent) {
        return parent.getRoleOf(this);
    }

    private boolean containsDescendant(AstNode node) {
        for (Attachment attachment : attachments) {
            if (attachment.node() == node || attachment.node().containsDescendant(node)) {
                return true;
            }
        }
        return false;
    }

    protected final void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Cannot modify frozen " + kind.displayName()
                + "; clone it or rewrite the tree through TreeEditor");
        }
    }

    // ==================== Freezing, cloning and persistent update ====================

    /**
     * Makes this node and its whole subtree immutable.
     */
    public final void freeze() {
        if (frozen) {
            return;
        }
        for (Attachment attachment : attachments) {
            attachment.node().freeze();
        }
        attached = false;
        frozen = true;
    }

    /**
     * Deep copy of this subtree. The copy is unfrozen, unattached and shares no nodes with the
     * original; tokens are immutable values and are shared.
     */
    public final AstNode cloneSubtree() {
        AstNode copy = newInstance();
        for (Attachment attachment : attachments) {
            AstNode childCopy = attachment.node().cloneSubtree();
            childCopy.attached = true;
            copy.attachments.add(new Attachment(attachment.role(), childCopy));
        }
        return copy;
    }

    /**
     * Returns an unfrozen copy of this frozen node whose attachment at {@code index} holds
     * {@code newChild}. All other children are shared with this node.
     */
    public final AstNode withAttachmentReplaced(int index, AstNode newChild) {
        Objects.requireNonNull(newChild, "newChild");
        AstNode copy = shallowCopy();
        Role role = attachments.get(index).role();
        copy.checkCategory(role, newChild);
        if (!newChild.frozen) {
            throw new IllegalArgumentException("Replacement " + newChild.kind.displayName() + " must be frozen");
        }
        copy.attachments.set(index, new Attachment(role, newChild));
        return copy;
    }

    /**
     * Returns an unfrozen copy of this frozen node without the attachment at {@code index}. When the
     * removed child belongs to a separated list, one adjacent separator token is removed with it.
     */
    public final AstNode withAttachmentRemoved(int index) {
        AstNode copy = shallowCopy();
        Role separator = attachments.get(index).role().getSeparator();
        copy.attachments.remove(index);
        if (separator != null) {
            if (index < copy.attachments.size() && copy.attachments.get(index).role() == separator) {
                copy.attachments.remove(index);
            } else if (index > 0 && copy.attachments.get(index - 1).role() == separator) {
                copy.attachments.remove(index - 1);
            }
        }
        return copy;
    }

    private AstNode shallowCopy() {
        if (!frozen) {
            throw new IllegalStateException("Persistent updates require a frozen " + kind.displayName());
        }
        AstNode copy = newInstance();
        copy.attachments.addAll(attachments);
        return copy;
    }

    /**
     * Creates an empty node of the same kind, carrying over leaf state (token, placeholder name).
     */
    protected abstract AstNode newInstance();

    // ==================== Structural equality ====================

    /**
     * Equality of kind and child structure, ignoring trivia and source positions. Never used for
     * identity; {@link #equals(Object)} stays reference equality.
     */
    public final boolean isStructurallyEqual(AstNode other) {
        if (this == other) {
            return true;
        }
        if (other == null || kind != other.kind || !leafEquals(other)) {
            return false;
        }
        if (attachments.size() != other.attachments.size()) {
            return false;
        }
        for (int i = 0; i < attachments.size(); i++) {
            Attachment a = attachments.get(i);
            Attachment b = other.attachments.get(i);
            if (a.role() != b.role() || !a.node().isStructurallyEqual(b.node())) {
                return false;
            }
        }
        return true;
    }

    public final int structuralHashCode() {
        int hash = kind.hashCode() * 31 + leafHashCode();
        for (Attachment attachment : attachments) {
            hash = hash * 31 + attachment.role().getId().hashCode();
            hash = hash * 31 + attachment.node().structuralHashCode();
        }
        return hash;
    }

    /**
     * Compares state held by the node itself rather than by its children.
     */
    protected boolean leafEquals(AstNode other) {
        return true;
    }

    protected int leafHashCode() {
        return 0;
    }

    // ==================== Tokens and spans ====================

    public TokenNode getFirstToken() {
        for (Attachment attachment : attachments) {
            TokenNode token = attachment.node().getFirstToken();
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    public TokenNode getLastToken() {
        for (int i = attachments.size() - 1; i >= 0; i--) {
            TokenNode token = attachments.get(i).node().getLastToken();
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    public final List<TokenNode> getTokens() {
        List<TokenNode> tokens = new ArrayList<>();
        collectTokens(tokens);
        return tokens;
    }

    private void collectTokens(List<TokenNode> into) {
        if (this instanceof TokenNode tokenNode) {
            into.add(tokenNode);
            return;
        }
        for (Attachment attachment : attachments) {
            attachment.node().collectTokens(into);
        }
    }

    /**
     * Source range from the first to the last lexed token of this subtree, excluding trivia.
     * Null when the subtree was built programmatically and has no lexed tokens.
     */
    public final TextSpan getSpan() {
        int start = -1;
        int end = -1;
        for (TokenNode token : getTokens()) {
            if (token.getToken().isSynthesized() || token.getToken().kind() == TokenKind.END_OF_FILE) {
                continue;
            }
            if (start < 0) {
                start = token.getToken().offset();
            }
            end = token.getToken().end();
        }
        return start < 0 ? null : new TextSpan(start, end);
    }

    // ==================== Visitors ====================

    public abstract <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data);

    // ==================== Typed accessor helpers ====================

    protected final <N extends AstNode> N getTypedChild(Role role, Class<N> type) {
        AstNode child = getChildByRole(role);
        return type.isInstance(child) ? type.cast(child) : null;
    }

    protected final <N extends AstNode> List<N> getTypedChildren(Role role, Class<N> type) {
        List<N> result = new ArrayList<>();
        for (AstNode child : getChildrenByRole(role)) {
            if (type.isInstance(child)) {
                result.add(type.cast(child));
            }
        }
        return result;
    }

    protected final String getTokenText(Role role) {
        AstNode child = getChildByRole(role);
        return child instanceof TokenNode token ? token.getText() : null;
    }

    @Override
    public String toString() {
        TextSpan span = getSpan();
        return kind.displayName() + (span != null ? span.toString() : "");
    }
}
