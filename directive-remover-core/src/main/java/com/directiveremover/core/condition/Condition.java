package com.directiveremover.core.condition;

import java.util.Set;

/**
 * Parsed form of an #if / #elif condition.
 *
 * Closed set of node types; classification walks it with instanceof checks,
 * the scanner evaluates it against the currently defined symbols.
 */
public sealed interface Condition
        permits Condition.Identifier, Condition.Not, Condition.And, Condition.Or,
                Condition.Paren, Condition.Comparison {

    boolean evaluate(Set<String> definedSymbols);

    /** Symbol reference, or one of the literals {@code true} / {@code false}. */
    record Identifier(String name) implements Condition {
        public boolean isLiteral() {
            return "true".equals(name) || "false".equals(name);
        }

        @Override
        public boolean evaluate(Set<String> definedSymbols) {
            if ("true".equals(name)) return true;
            if ("false".equals(name)) return false;
            return definedSymbols.contains(name);
        }
    }

    record Not(Condition operand) implements Condition {
        @Override
        public boolean evaluate(Set<String> definedSymbols) {
            return !operand.evaluate(definedSymbols);
        }
    }

    record And(Condition left, Condition right) implements Condition {
        @Override
        public boolean evaluate(Set<String> definedSymbols) {
            return left.evaluate(definedSymbols) && right.evaluate(definedSymbols);
        }
    }

    record Or(Condition left, Condition right) implements Condition {
        @Override
        public boolean evaluate(Set<String> definedSymbols) {
            return left.evaluate(definedSymbols) || right.evaluate(definedSymbols);
        }
    }

    record Paren(Condition inner) implements Condition {
        @Override
        public boolean evaluate(Set<String> definedSymbols) {
            return inner.evaluate(definedSymbols);
        }
    }

    /** {@code ==} when {@code negated} is false, {@code !=} otherwise. */
    record Comparison(Condition left, Condition right, boolean negated) implements Condition {
        @Override
        public boolean evaluate(Set<String> definedSymbols) {
            boolean equal = left.evaluate(definedSymbols) == right.evaluate(definedSymbols);
            return negated != equal;
        }
    }

    /** Strips any number of redundant parentheses. */
    static Condition unwrap(Condition condition) {
        Condition current = condition;
        while (current instanceof Paren paren) {
            current = paren.inner();
        }
        return current;
    }
}
