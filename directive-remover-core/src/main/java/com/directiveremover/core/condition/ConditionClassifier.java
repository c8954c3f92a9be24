package com.directiveremover.core.condition;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Classifies target opener conditions by shape. Never evaluates them.
 */
public class ConditionClassifier {

    private final List<String> targetAliases;

    public ConditionClassifier(Collection<String> targetAliases) {
        this.targetAliases = targetAliases.stream()
            .map(a -> a.toUpperCase(Locale.ROOT))
            .collect(Collectors.toList());
    }

    public ConditionShape classify(Condition condition) {
        boolean bareNegation = isBareNegation(condition);
        boolean negatedBoolean = isNegatedBoolean(condition);
        // negated-boolean is the more specific of the two
        boolean containsBoolean = !negatedBoolean && containsBoolean(condition);
        boolean irregular = !bareNegation && !negatedBoolean && !containsBoolean
            && !reducesToTargetIdentifier(condition);
        return new ConditionShape(bareNegation, negatedBoolean, containsBoolean, irregular);
    }

    /** {@code !T}, {@code !(T)}, {@code (!T)}. */
    static boolean isBareNegation(Condition condition) {
        return Condition.unwrap(condition) instanceof Condition.Not not
            && Condition.unwrap(not.operand()) instanceof Condition.Identifier;
    }

    /** {@code !(A && B)}, {@code !(A || B)}. */
    static boolean isNegatedBoolean(Condition condition) {
        if (!(Condition.unwrap(condition) instanceof Condition.Not not)) return false;
        if (!(not.operand() instanceof Condition.Paren paren)) return false;
        Condition inner = Condition.unwrap(paren);
        return inner instanceof Condition.And || inner instanceof Condition.Or;
    }

    /** Looks through negation and parentheses only; AND/OR below a comparison do not count. */
    static boolean containsBoolean(Condition condition) {
        if (condition instanceof Condition.And || condition instanceof Condition.Or) return true;
        if (condition instanceof Condition.Not not) return containsBoolean(not.operand());
        if (condition instanceof Condition.Paren paren) return containsBoolean(paren.inner());
        return false;
    }

    private boolean reducesToTargetIdentifier(Condition condition) {
        Condition core = Condition.unwrap(condition);
        if (core instanceof Condition.Not not) {
            core = Condition.unwrap(not.operand());
        }
        return core instanceof Condition.Identifier id
            && !id.isLiteral()
            && targetAliases.contains(id.name().toUpperCase(Locale.ROOT));
    }
}
