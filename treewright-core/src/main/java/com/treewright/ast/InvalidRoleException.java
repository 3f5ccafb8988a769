package com.treewright.ast;

import com.treewright.TreewrightException;

/**
 * Thrown when a node is asked for, or given, a child under a role its kind does not declare,
 * or when the child's category does not fit the role.
 */
public class InvalidRoleException extends TreewrightException {

    private final NodeKind kind;
    private final Role role;

    public InvalidRoleException(NodeKind kind, Role role, String message) {
        super(message);
        this.kind = kind;
        this.role = role;
    }

    public InvalidRoleException(NodeKind kind, Role role) {
        this(kind, role, "Role '" + role.getId() + "' is not declared for " + kind.displayName());
    }

    public NodeKind getKind() {
        return kind;
    }

    public Role getRole() {
        return role;
    }
}
