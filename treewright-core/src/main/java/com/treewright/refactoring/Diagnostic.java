package com.treewright.refactoring;

import com.treewright.ast.NodePath;
import com.treewright.ast.TextSpan;

import java.util.List;

/**
 * A finding reported by a {@link DiagnosticAnalyzer}, with the fixes it offers.
 *
 * @param span source range of the offending code, or null for synthesized code
 * @param path position of the offending node
 */
public record Diagnostic(
    String id,
    String message,
    DiagnosticSeverity severity,
    TextSpan span,
    NodePath path,
    List<CodeAction> fixes
) {
    public Diagnostic {
        fixes = fixes == null ? List.of() : List.copyOf(fixes);
    }
}
