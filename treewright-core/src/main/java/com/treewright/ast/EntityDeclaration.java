package com.treewright.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Common base of type and member declarations: both carry attributes, modifiers and a name.
 */
public abstract class EntityDeclaration extends AstNode {

    protected EntityDeclaration(NodeKind kind) {
        super(kind);
    }

    public List<Attribute> getAttributes() {
        return getTypedChildren(Roles.ATTRIBUTE, Attribute.class);
    }

    public void addAttribute(Attribute attribute) {
        addChild(Roles.ATTRIBUTE, attribute);
    }

    public List<TokenNode> getModifierTokens() {
        return getTypedChildren(Roles.MODIFIER, TokenNode.class);
    }

    public List<String> getModifiers() {
        List<String> result = new ArrayList<>();
        for (TokenNode token : getModifierTokens()) {
            result.add(token.getText());
        }
        return result;
    }

    public boolean hasModifier(String modifier) {
        return getModifiers().contains(modifier);
    }

    public TokenNode getNameToken() {
        return getTypedChild(Roles.IDENTIFIER, TokenNode.class);
    }

    public String getName() {
        return getTokenText(Roles.IDENTIFIER);
    }
}
