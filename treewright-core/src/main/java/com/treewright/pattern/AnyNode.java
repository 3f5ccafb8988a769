package com.treewright.pattern;

import com.treewright.ast.AstNode;
import com.treewright.ast.NodeKind;
import com.treewright.visitor.AstVisitor;

import java.util.Objects;

/**
 * Wildcard placeholder: matches any single node, optionally only nodes of one kind. A named
 * wildcard binds the matched subtree; when the same name occurs again in the pattern, the second
 * occurrence only matches a subtree structurally equal to the first.
 */
public final class AnyNode extends AstNode {

    private final String name;
    private final NodeKind restriction;

    public AnyNode() {
        this(null, null);
    }

    public AnyNode(String name) {
        this(name, null);
    }

    public AnyNode(String name, NodeKind restriction) {
        super(NodeKind.ANY_NODE);
        this.name = name;
        this.restriction = restriction;
    }

    /**
     * Binding name, or null for an anonymous wildcard.
     */
    public String getName() {
        return name;
    }

    /**
     * Kind the matched node must have, or null for any kind.
     */
    public NodeKind getRestriction() {
        return restriction;
    }

    public boolean accepts(AstNode candidate) {
        return restriction == null || candidate.getKind() == restriction;
    }

    @Override
    protected boolean leafEquals(AstNode other) {
        AnyNode o = (AnyNode) other;
        return Objects.equals(name, o.name) && restriction == o.restriction;
    }

    @Override
    protected int leafHashCode() {
        return Objects.hash(name, restriction);
    }

    @Override
    protected AstNode newInstance() {
        return new AnyNode(name, restriction);
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitAnyNode(this, data);
    }

    @Override
    public String toString() {
        return "AnyNode(" + (name != null ? name : "_") + (restriction != null ? ": " + restriction.displayName() : "") + ")";
    }
}
