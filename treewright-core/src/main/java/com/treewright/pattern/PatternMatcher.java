package com.treewright.pattern;

import com.treewright.ast.AstNode;
import com.treewright.ast.NodeKind;
import com.treewright.ast.Role;
import com.treewright.ast.RoleRegistry;
import com.treewright.ast.Roles;
import com.treewright.ast.SyntaxTree;
import com.treewright.ast.TokenNode;
import com.treewright.visitor.CancellationToken;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Structural matching of pattern trees against candidate subtrees.
 *
 * <p>A pattern is an ordinary node tree that may contain {@link AnyNode} and {@link Repeat}
 * placeholders. Apart from placeholders, a candidate matches when it has the same kind, the same
 * populated roles and pairwise matching children. Separator tokens, trivia and source positions
 * are ignored; tokens compare by kind and text.</p>
 *
 * <p>Matching is pure: it reads both trees, never modifies them, and gives the same result for the
 * same inputs.</p>
 */
public final class PatternMatcher {

    private static final Logger LOG = Logger.getLogger(PatternMatcher.class.getName());

    private PatternMatcher() {
    }

    public static MatchResult match(AstNode pattern, AstNode candidate) {
        return match(pattern, candidate, MatchResult.empty());
    }

    /**
     * Matches with names already bound by {@code bindingsSoFar}; those names must match
     * structurally equal subtrees again.
     *
     * @throws IllegalArgumentException if the pattern places two {@link Repeat}s in one role
     *                                  sequence or uses a {@link Repeat} as a whole pattern
     */
    public static MatchResult match(AstNode pattern, AstNode candidate, MatchResult bindingsSoFar) {
        if (!bindingsSoFar.isSuccess() || candidate == null) {
            return MatchResult.FAILED;
        }
        Map<String, MatchResult.Binding> bindings = matchNode(pattern, candidate, bindingsSoFar.getBindings());
        return bindings == null ? MatchResult.FAILED : MatchResult.success(candidate, bindings);
    }

    /**
     * All subtrees of {@code root} matching {@code pattern}, in pre-order.
     */
    public static List<MatchResult> findMatches(AstNode root, AstNode pattern) {
        return findMatches(root, pattern, CancellationToken.NONE);
    }

    public static List<MatchResult> findMatches(SyntaxTree tree, AstNode pattern, CancellationToken cancellation) {
        return findMatches(tree.getRoot(), pattern, cancellation);
    }

    public static List<MatchResult> findMatches(AstNode root, AstNode pattern, CancellationToken cancellation) {
        List<MatchResult> results = new ArrayList<>();
        List<AstNode> stack = new ArrayList<>();
        stack.add(root);
        int visited = 0;
        while (!stack.isEmpty()) {
            cancellation.throwIfCancellationRequested();
            AstNode node = stack.remove(stack.size() - 1);
            visited++;
            MatchResult result = match(pattern, node);
            if (result.isSuccess()) {
                results.add(result);
            }
            List<AstNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.add(children.get(i));
            }
        }
        int count = visited;
        LOG.fine(() -> "Pattern " + pattern.getKind().displayName() + " matched " + results.size()
            + " of " + count + " nodes");
        return results;
    }

    private static Map<String, MatchResult.Binding> matchNode(AstNode pattern, AstNode candidate,
                                                             Map<String, MatchResult.Binding> bindings) {
        if (pattern instanceof AnyNode any) {
            if (!any.accepts(candidate)) {
                return null;
            }
            return bind(any.getName(), MatchResult.Binding.single(candidate), bindings);
        }
        if (pattern instanceof Repeat) {
            throw new IllegalArgumentException("Repeat placeholders may only appear inside a MANY role sequence");
        }
        if (pattern.getKind() != candidate.getKind()) {
            return null;
        }
        if (pattern instanceof TokenNode patternToken) {
            TokenNode candidateToken = (TokenNode) candidate;
            boolean same = patternToken.getTokenKind() == candidateToken.getTokenKind()
                && patternToken.getText().equals(candidateToken.getText());
            return same ? bindings : null;
        }
        NodeKind kind = pattern.getKind();
        RoleRegistry registry = Roles.registry();
        Map<String, MatchResult.Binding> current = bindings;
        for (Role role : registry.rolesOf(kind)) {
            if (registry.isSeparator(kind, role)) {
                continue;
            }
            List<AstNode> patternChildren = pattern.getChildrenByRole(role);
            List<AstNode> candidateChildren = candidate.getChildrenByRole(role);
            if (role.isMany()) {
                current = matchSequence(patternChildren, candidateChildren, current);
            } else if (patternChildren.size() != candidateChildren.size()) {
                return null;
            } else if (!patternChildren.isEmpty()) {
                current = matchNode(patternChildren.get(0), candidateChildren.get(0), current);
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static Map<String, MatchResult.Binding> matchSequence(List<AstNode> patterns, List<AstNode> candidates,
                                                                 Map<String, MatchResult.Binding> bindings) {
        int repeatIndex = -1;
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i) instanceof Repeat) {
                if (repeatIndex >= 0) {
                    throw new IllegalArgumentException("At most one Repeat placeholder is allowed per role sequence");
                }
                repeatIndex = i;
            }
        }
        if (repeatIndex < 0) {
            if (patterns.size() != candidates.size()) {
                return null;
            }
            return matchPairwise(patterns, 0, candidates, 0, patterns.size(), bindings);
        }

        int prefix = repeatIndex;
        int suffix = patterns.size() - repeatIndex - 1;
        if (candidates.size() < prefix + suffix) {
            return null;
        }
        Map<String, MatchResult.Binding> current = matchPairwise(patterns, 0, candidates, 0, prefix, bindings);
        if (current == null) {
            return null;
        }
        // Greedy: the repeat takes everything the fixed-length suffix leaves over
        int taken = candidates.size() - prefix - suffix;
        current = matchPairwise(patterns, repeatIndex + 1, candidates, prefix + taken, suffix, current);
        if (current == null) {
            return null;
        }
        Repeat repeat = (Repeat) patterns.get(repeatIndex);
        List<AstNode> run = candidates.subList(prefix, prefix + taken);
        return bind(repeat.getName(), MatchResult.Binding.sequence(run), current);
    }

    private static Map<String, MatchResult.Binding> matchPairwise(List<AstNode> patterns, int patternStart,
                                                                 List<AstNode> candidates, int candidateStart,
                                                                 int count, Map<String, MatchResult.Binding> bindings) {
        Map<String, MatchResult.Binding> current = bindings;
        for (int i = 0; i < count && current != null; i++) {
            current = matchNode(patterns.get(patternStart + i), candidates.get(candidateStart + i), current);
        }
        return current;
    }

    private static Map<String, MatchResult.Binding> bind(String name, MatchResult.Binding binding,
                                                        Map<String, MatchResult.Binding> bindings) {
        if (name == null) {
            return bindings;
        }
        MatchResult.Binding existing = bindings.get(name);
        if (existing != null) {
            return existing.isStructurallyEqual(binding) ? bindings : null;
        }
        Map<String, MatchResult.Binding> extended = new LinkedHashMap<>(bindings);
        extended.put(name, binding);
        return extended;
    }
}
