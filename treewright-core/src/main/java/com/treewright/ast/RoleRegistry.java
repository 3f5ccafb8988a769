package com.treewright.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide table of roles and of the ordered role list each node kind accepts.
 *
 * <p>A registry is assembled once through a {@link Builder} and is read-only afterwards, so it
 * may be shared freely between threads. The standard registry lives in {@link Roles}.</p>
 */
public final class RoleRegistry {

    private final Map<String, Role> roles;
    private final Map<NodeKind, List<Role>> declared;
    private final Map<NodeKind, Map<Role, Integer>> ranks;
    private final Map<NodeKind, Set<Role>> separators;

    private RoleRegistry(Map<String, Role> roles, Map<NodeKind, List<Role>> declared) {
        this.roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
        this.declared = new EnumMap<>(NodeKind.class);
        this.ranks = new EnumMap<>(NodeKind.class);
        this.separators = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : NodeKind.values()) {
            List<Role> list = List.copyOf(declared.getOrDefault(kind, List.of()));
            this.declared.put(kind, list);

            Map<Role, Integer> rank = new IdentityHashMap<>();
            Set<Role> seps = Collections.newSetFromMap(new IdentityHashMap<>());
            for (int i = 0; i < list.size(); i++) {
                rank.putIfAbsent(list.get(i), i);
            }
            // A separator sorts together with the list it separates
            for (Role role : list) {
                if (role.getSeparator() != null) {
                    rank.put(role.getSeparator(), rank.get(role));
                    seps.add(role.getSeparator());
                }
            }
            this.ranks.put(kind, rank);
            this.separators.put(kind, seps);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Roles accepted by {@code kind}, in source order.
     */
    public List<Role> rolesOf(NodeKind kind) {
        return declared.get(kind);
    }

    public boolean isDeclared(NodeKind kind, Role role) {
        return ranks.get(kind).containsKey(role);
    }

    /**
     * Relative source position of {@code role} among the roles of {@code kind}.
     *
     * @throws InvalidRoleException if the role is not declared for the kind
     */
    public int rankOf(NodeKind kind, Role role) {
        Integer rank = ranks.get(kind).get(role);
        if (rank == null) {
            throw new InvalidRoleException(kind, role);
        }
        return rank;
    }

    /**
     * Whether {@code role} only carries separator tokens for another role of {@code kind}.
     */
    public boolean isSeparator(NodeKind kind, Role role) {
        return separators.get(kind).contains(role);
    }

    /**
     * Looks up a role by id, or returns null when no such role is registered.
     */
    public Role findRole(String id) {
        return roles.get(id);
    }

    public Collection<Role> roles() {
        return roles.values();
    }

    /**
     * Collects role registrations and per-kind declarations during startup.
     */
    public static final class Builder {
        private final Map<String, Role> roles = new LinkedHashMap<>();
        private final Map<NodeKind, List<Role>> declared = new EnumMap<>(NodeKind.class);
        private boolean sealed;

        private Builder() {
        }

        public Role register(String id, NodeCategory category, Cardinality cardinality) {
            return register(id, category, cardinality, null, null);
        }

        /**
         * Registers a MANY role whose elements are separated by tokens under {@code separator}.
         */
        public Role registerSeparated(String id, NodeCategory category, Role separator, String separatorText) {
            if (separator == null || separator.getCategory() != NodeCategory.TOKEN || !separator.isMany()) {
                throw new ConfigurationException("Separator for '" + id + "' must be a MANY token role");
            }
            return register(id, category, Cardinality.MANY, separator, separatorText);
        }

        private Role register(String id, NodeCategory category, Cardinality cardinality, Role separator,
                              String separatorText) {
            checkNotSealed();
            Role existing = roles.get(id);
            if (existing != null) {
                if (existing.getCardinality() != cardinality) {
                    throw new ConfigurationException("Role '" + id + "' already registered with cardinality "
                        + existing.getCardinality() + ", cannot re-register as " + cardinality);
                }
                if (existing.getCategory() != category) {
                    throw new ConfigurationException("Role '" + id + "' already registered with category "
                        + existing.getCategory() + ", cannot re-register as " + category);
                }
                return existing;
            }
            Role role = new Role(id, category, cardinality, separator, separatorText);
            roles.put(id, role);
            return role;
        }

        public Builder declare(NodeKind kind, Role... kindRoles) {
            checkNotSealed();
            List<Role> list = new ArrayList<>();
            for (Role role : kindRoles) {
                if (roles.get(role.getId()) != role) {
                    throw new ConfigurationException("Role '" + role.getId() + "' declared for "
                        + kind.displayName() + " is not registered in this registry");
                }
                if (list.contains(role)) {
                    throw new ConfigurationException("Role '" + role.getId() + "' declared twice for " + kind.displayName());
                }
                list.add(role);
            }
            for (Role role : list) {
                if (role.getSeparator() != null && !list.contains(role.getSeparator())) {
                    throw new ConfigurationException("Separator role '" + role.getSeparator().getId()
                        + "' of '" + role.getId() + "' is not declared for " + kind.displayName());
                }
            }
            declared.put(kind, list);
            return this;
        }

        public RoleRegistry build() {
            checkNotSealed();
            sealed = true;
            return new RoleRegistry(roles, declared);
        }

        private void checkNotSealed() {
            if (sealed) {
                throw new ConfigurationException("Role registry is sealed; roles must be registered before first use");
            }
        }
    }
}
