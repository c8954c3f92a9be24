package com.directiveremover.core.scan;

/**
 * A syntax error found while scanning. Diagnostics are values, never thrown.
 */
public record SyntaxDiagnostic(int offset, int line, String message) {

    @Override
    public String toString() {
        return "line " + line + ": " + message;
    }
}
