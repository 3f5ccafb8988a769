package com.treewright.ast;

import java.util.Objects;

/**
 * A child node together with the role it fills in its parent.
 */
public record Attachment(Role role, AstNode node) {

    public Attachment {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(node, "node");
    }
}
