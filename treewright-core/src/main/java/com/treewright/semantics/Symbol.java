package com.treewright.semantics;

/**
 * A declared entity as seen by an external semantic model.
 */
public interface Symbol {

    String getName();

    SymbolKind getKind();

    /**
     * Fully qualified name, e.g. {@code NUnit.Framework.TestAttribute}.
     */
    String getQualifiedName();
}
