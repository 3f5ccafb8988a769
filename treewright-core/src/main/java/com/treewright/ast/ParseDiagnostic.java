package com.treewright.ast;

/**
 * A syntax error reported by the parser. Parsing never throws for malformed input; it records
 * diagnostics and keeps the unparseable region in an {@link ErrorNode}.
 */
public record ParseDiagnostic(String message, int offset, int length) {

    public TextSpan span() {
        return new TextSpan(offset, offset + length);
    }

    @Override
    public String toString() {
        return message + " at " + offset;
    }
}
