package com.treewright.pattern;

import com.treewright.ast.AstNode;
import com.treewright.ast.NodeKind;
import com.treewright.visitor.AstVisitor;

import java.util.Objects;

/**
 * Any-number placeholder: inside a MANY role it matches zero or more consecutive siblings and
 * binds them, in order, as a sequence. A role sequence may hold at most one.
 */
public final class Repeat extends AstNode {

    private final String name;

    public Repeat() {
        this(null);
    }

    public Repeat(String name) {
        super(NodeKind.REPEAT);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    protected boolean leafEquals(AstNode other) {
        return Objects.equals(name, ((Repeat) other).name);
    }

    @Override
    protected int leafHashCode() {
        return Objects.hashCode(name);
    }

    @Override
    protected AstNode newInstance() {
        return new Repeat(name);
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitRepeat(this, data);
    }

    @Override
    public String toString() {
        return "Repeat(" + (name != null ? name : "_") + ")";
    }
}
