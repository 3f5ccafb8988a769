package com.treewright.rewrite;

import com.treewright.TreewrightException;

/**
 * Thrown when an edit no longer fits the tree it is applied to: its target path does not resolve,
 * or its precondition pattern no longer matches.
 */
public class StaleEditException extends TreewrightException {

    private final Edit edit;

    public StaleEditException(String message, Edit edit) {
        super(message);
        this.edit = edit;
    }

    public Edit getEdit() {
        return edit;
    }
}
