package com.treewright.rewrite;

import com.treewright.TreewrightException;

/**
 * Thrown when two edits of one batch touch the same region: the same node, a node and one of its
 * descendants, or overlapping source spans. The tree is left unmodified.
 */
public class ConflictingEditException extends TreewrightException {

    private final Edit first;
    private final Edit second;

    public ConflictingEditException(String message, Edit first, Edit second) {
        super(message);
        this.first = first;
        this.second = second;
    }

    public Edit getFirst() {
        return first;
    }

    public Edit getSecond() {
        return second;
    }
}
