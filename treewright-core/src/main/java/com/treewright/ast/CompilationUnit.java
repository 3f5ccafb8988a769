package com.treewright.ast;

import com.treewright.visitor.AstVisitor;

import java.util.List;

/**
 * Root of a parsed source file. Trivia after the last declaration is kept on the end-of-file token.
 */
public final class CompilationUnit extends AstNode {

    public CompilationUnit() {
        super(NodeKind.COMPILATION_UNIT);
    }

    /**
     * Top-level declarations, including any {@link ErrorNode}s recovered between them.
     */
    public List<AstNode> getMembers() {
        return getChildrenByRole(Roles.MEMBER);
    }

    public List<TypeDeclaration> getTypes() {
        return getTypedChildren(Roles.MEMBER, TypeDeclaration.class);
    }

    public void addMember(AstNode member) {
        addChild(Roles.MEMBER, member);
    }

    public TokenNode getEndOfFile() {
        return getTypedChild(Roles.END_OF_FILE, TokenNode.class);
    }

    @Override
    protected AstNode newInstance() {
        return new CompilationUnit();
    }

    @Override
    public <T, S> S acceptVisitor(AstVisitor<T, S> visitor, T data) {
        return visitor.visitCompilationUnit(this, data);
    }
}
