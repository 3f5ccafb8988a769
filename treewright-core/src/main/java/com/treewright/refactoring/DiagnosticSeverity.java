package com.treewright.refactoring;

public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO,
    HIDDEN
}
