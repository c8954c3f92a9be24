package com.directiveremover.core.verify;

/**
 * A conditional directive without its structural partner.
 *
 * @param line    1-based line in the checked text
 * @param message e.g. "#else without matching #if"
 */
public record OrphanedDirective(int line, String message) {

    @Override
    public String toString() {
        return "Orphaned directive at line " + line + ": " + message;
    }
}
