package com.treewright.refactoring;

import java.util.List;

/**
 * Offers caret-driven refactorings. Implementations inspect the context and return the actions
 * that apply at the caret, or an empty list.
 */
public interface CodeRefactoringProvider {

    List<CodeAction> getActions(RefactoringContext context);
}
