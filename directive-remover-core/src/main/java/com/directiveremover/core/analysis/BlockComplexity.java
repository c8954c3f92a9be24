package com.directiveremover.core.analysis;

public enum BlockComplexity {
    /** {@code #if T}: the if-branch is kept. */
    SIMPLE,
    /** {@code #if !T}: the if-branch is dead, an else-branch is kept. */
    NEGATED,
    /** Anything else; never rewritten, flagged for review instead. */
    COMPLEX
}
