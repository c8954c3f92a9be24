package com.directiveremover.core.analysis;

import com.directiveremover.core.scan.Directive;
import com.directiveremover.core.scan.TextSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * A complete {@code #if ... #endif} construct whose opener mentions the target symbol.
 *
 * Only this block's own directives are referenced; directives of nested blocks are
 * never part of it. {@code disabledSpans} are the dead-branch regions that belong to
 * this block, empty for complex blocks.
 *
 * @param ifDirective       the opener
 * @param elseDirective     the {@code #else} at this block's depth, or null
 * @param elifDirectives    {@code #elif}s at this block's depth, in order
 * @param endIfDirective    the closer
 * @param negated           opener is {@code !T} (redundant parentheses allowed)
 * @param negatedBoolean    opener is {@code !(A && B)} or {@code !(A || B)}
 * @param booleanExpression opener has an AND/OR reachable through negations and parentheses
 * @param irregular         opener is some other shape, e.g. a comparison or a literal
 * @param disabledSpans     dead text to delete when the target is assumed defined
 */
public record DirectiveBlock(
    Directive ifDirective,
    Directive elseDirective,
    List<Directive> elifDirectives,
    Directive endIfDirective,
    boolean negated,
    boolean negatedBoolean,
    boolean booleanExpression,
    boolean irregular,
    List<TextSpan> disabledSpans
) {

    public DirectiveBlock {
        elifDirectives = List.copyOf(elifDirectives);
        disabledSpans = List.copyOf(disabledSpans);
    }

    public boolean hasElse() {
        return elseDirective != null;
    }

    public boolean hasElif() {
        return !elifDirectives.isEmpty();
    }

    public BlockComplexity complexity() {
        if (hasElif() || booleanExpression || negatedBoolean || irregular) {
            return BlockComplexity.COMPLEX;
        }
        return negated ? BlockComplexity.NEGATED : BlockComplexity.SIMPLE;
    }

    public boolean isComplex() {
        return complexity() == BlockComplexity.COMPLEX;
    }

    /** Line of the opener, used for reporting. */
    public int line() {
        return ifDirective.line();
    }

    /** Full line spans of this block's own directives, in source order. */
    public List<TextSpan> directiveLines() {
        List<TextSpan> lines = new ArrayList<>();
        lines.add(ifDirective.lineSpan());
        for (Directive elif : elifDirectives) {
            lines.add(elif.lineSpan());
        }
        if (elseDirective != null) {
            lines.add(elseDirective.lineSpan());
        }
        lines.add(endIfDirective.lineSpan());
        return lines;
    }

    public DirectiveBlock withDisabledSpans(List<TextSpan> spans) {
        return new DirectiveBlock(ifDirective, elseDirective, elifDirectives, endIfDirective,
            negated, negatedBoolean, booleanExpression, irregular, spans);
    }

    @Override
    public String toString() {
        return "DirectiveBlock[" + ifDirective + ", " + complexity() + "]";
    }
}
