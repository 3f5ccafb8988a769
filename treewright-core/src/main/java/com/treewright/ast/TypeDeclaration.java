package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

import java.util.List;

/**
 * {@code class Name { members }}
 */
public final class TypeDeclaration extends EntityDeclaration {

    public TypeDeclaration() {
        super(NodeKind.TYPE_DECLARATION);
    }

    public List<AstNode> getMembers() {
        return getChildrenByRole(Roles.MEMBER);
    }

    public List<MethodDeclaration> getMethods() {
        return getTypedChildren(Roles.MEMBER, MethodDeclaration.class);
    }

    public void addMember(AstNode member) {
        addChild(Roles.MEMBER, member);
    }

    @Override
    protected AstNode newInstance() {
        return new TypeDeclaration();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitTypeDeclaration(this, data);
    }
}
