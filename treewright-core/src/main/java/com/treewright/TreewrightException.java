package com.treewright;

/**
 * Base class for all faults raised by the treewright core.
 *
 * <p>A failed pattern match is never reported through this hierarchy; it is the normal
 * {@code MatchResult.isSuccess() == false} outcome.</p>
 */
public class TreewrightException extends RuntimeException {

    public TreewrightException(String message) {
        super(message);
    }

    public TreewrightException(String message, Throwable cause) {
        super(message, cause);
    }
}
