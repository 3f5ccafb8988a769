package com.treewright.ast;

import com.treewright.TreewrightException;

/**
 * Thrown when a role is accessed with the wrong cardinality, e.g. assigning a sequence of
 * children to a role that holds at most one.
 */
public class CardinalityException extends TreewrightException {

    private final Role role;

    public CardinalityException(Role role, String message) {
        super(message);
        this.role = role;
    }

    public Role getRole() {
        return role;
    }
}
