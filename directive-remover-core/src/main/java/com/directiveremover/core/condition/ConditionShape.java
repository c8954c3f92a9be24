package com.directiveremover.core.condition;

/**
 * Structural flags of an opener condition.
 * {@code negatedBoolean} and {@code containsBoolean} are never both true.
 */
public record ConditionShape(
    boolean bareNegation,
    boolean negatedBoolean,
    boolean containsBoolean,
    boolean irregular
) {}
