package com.treewright.ast;

import com.treewright.TreewrightException;

/**
 * Thrown when the role registry is configured inconsistently: two registrations of the same
 * role id disagree, a node kind declares an unknown role, or a sealed registry is modified. Also
 * raised for rewrite options that cannot be parsed.
 */
public class ConfigurationException extends TreewrightException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
