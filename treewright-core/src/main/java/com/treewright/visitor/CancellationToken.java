package com.treewright.visitor;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag polled by long tree walks between node visits.
 *
 * <p>A walk that sees the flag set throws {@link CancellationException}. Walks are read-only,
 * so stopping early never leaves a tree half modified.</p>
 */
public class CancellationToken {

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
    };

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new CancellationException("Tree walk cancelled");
        }
    }
}
