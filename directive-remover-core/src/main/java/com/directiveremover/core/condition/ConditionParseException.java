package com.directiveremover.core.condition;

/**
 * Raised when an #if / #elif condition is not a valid preprocessor expression.
 */
public class ConditionParseException extends Exception {

    private final int column;

    public ConditionParseException(String message, int column) {
        super(message);
        this.column = column;
    }

    /** Zero-based column within the condition text. */
    public int getColumn() {
        return column;
    }
}
