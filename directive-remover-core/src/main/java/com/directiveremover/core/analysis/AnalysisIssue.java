package com.directiveremover.core.analysis;

/**
 * Advisory diagnostic for a block that needs manual attention.
 *
 * @param line    1-based line of the directive the issue is about
 * @param offset  offset of that directive's '#'
 * @param message human-readable reason
 */
public record AnalysisIssue(int line, int offset, String message) {

    @Override
    public String toString() {
        return "line " + line + ": " + message;
    }
}
