package com.treewright.refactoring;

import java.util.List;

/**
 * Scans a whole tree and reports {@link Diagnostic}s.
 */
public interface DiagnosticAnalyzer {

    String getId();

    List<Diagnostic> analyze(RefactoringContext context);
}
