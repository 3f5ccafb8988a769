package com.treewright.ast;

/**
 * A named, typed child slot. Roles are created only through {@link RoleRegistry.Builder}
 * and compared by identity.
 */
public final class Role {

    private final String id;
    private final NodeCategory category;
    private final Cardinality cardinality;
    private final Role separator;  // Token role placed between elements of a MANY role, may be null
    private final String separatorText;

    Role(String id, NodeCategory category, Cardinality cardinality, Role separator, String separatorText) {
        this.id = id;
        this.category = category;
        this.cardinality = cardinality;
        this.separator = separator;
        this.separatorText = separatorText;
    }

    public String getId() {
        return id;
    }

    public NodeCategory getCategory() {
        return category;
    }

    public Cardinality getCardinality() {
        return cardinality;
    }

    public boolean isMany() {
        return cardinality == Cardinality.MANY;
    }

    public Role getSeparator() {
        return separator;
    }

    /**
     * Text of the separator token generated between elements, e.g. {@code ","}.
     */
    public String getSeparatorText() {
        return separatorText;
    }

    @Override
    public String toString() {
        return id;
    }
}
