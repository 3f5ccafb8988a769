package com.treewright.pattern;

import com.treewright.ast.AstNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of matching a pattern against a candidate. Immutable.
 */
public final class MatchResult {

    public static final MatchResult FAILED = new MatchResult(false, Map.of(), null);

    /**
     * What a placeholder name is bound to: a single node for a wildcard, an ordered run of
     * siblings for a {@link Repeat}.
     */
    public record Binding(List<AstNode> nodes, boolean sequence) {
        public Binding {
            nodes = List.copyOf(nodes);
        }

        public static Binding single(AstNode node) {
            return new Binding(List.of(node), false);
        }

        public static Binding sequence(List<AstNode> nodes) {
            return new Binding(nodes, true);
        }

        public boolean isStructurallyEqual(Binding other) {
            if (nodes.size() != other.nodes.size()) {
                return false;
            }
            for (int i = 0; i < nodes.size(); i++) {
                if (!nodes.get(i).isStructurallyEqual(other.nodes.get(i))) {
                    return false;
                }
            }
            return true;
        }
    }

    private final boolean success;
    private final Map<String, Binding> bindings;
    private final AstNode matchedNode;

    private MatchResult(boolean success, Map<String, Binding> bindings, AstNode matchedNode) {
        this.success = success;
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.matchedNode = matchedNode;
    }

    static MatchResult success(AstNode matchedNode, Map<String, Binding> bindings) {
        return new MatchResult(true, bindings, Objects.requireNonNull(matchedNode, "matchedNode"));
    }

    /**
     * An empty successful result, used to seed a match with no prior bindings.
     */
    public static MatchResult empty() {
        return new MatchResult(true, Map.of(), null);
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, Binding> getBindings() {
        return bindings;
    }

    /**
     * The candidate node the pattern matched, or null for a failed or seed result.
     */
    public AstNode getMatchedNode() {
        return matchedNode;
    }

    public boolean has(String name) {
        return bindings.containsKey(name);
    }

    /**
     * Node bound to a wildcard name, or null when the name is unbound or bound to an empty sequence.
     */
    public AstNode get(String name) {
        Binding binding = bindings.get(name);
        if (binding == null || binding.nodes().isEmpty()) {
            return null;
        }
        return binding.nodes().get(0);
    }

    /**
     * Nodes bound to a name; a wildcard binding yields a one-element list.
     */
    public List<AstNode> getSequence(String name) {
        Binding binding = bindings.get(name);
        return binding == null ? List.of() : binding.nodes();
    }

    @Override
    public String toString() {
        return success ? "MatchResult" + bindings.keySet() : "MatchResult.FAILED";
    }
}
