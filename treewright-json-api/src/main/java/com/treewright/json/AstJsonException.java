package com.treewright.json;

import com.treewright.TreewrightException;

/**
 * A tree could not be written as JSON, or JSON could not be read back into a well formed tree.
 * The underlying library's exception is kept as the cause.
 */
public class AstJsonException extends TreewrightException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
