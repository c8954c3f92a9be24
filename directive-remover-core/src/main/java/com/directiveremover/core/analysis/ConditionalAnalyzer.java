package com.directiveremover.core.analysis;

import com.directiveremover.core.condition.ConditionClassifier;
import com.directiveremover.core.condition.ConditionShape;
import com.directiveremover.core.scan.Directive;
import com.directiveremover.core.scan.DirectiveKind;
import com.directiveremover.core.scan.TextSpan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Finds the conditional blocks bound to the target symbol and classifies them.
 *
 * An opener is target-relevant when its condition text mentions any alias of the
 * target, ignoring case. Siblings are paired by depth: a directive belongs to the
 * nearest unmatched opener. A target block nested in another block's dead branch
 * is not reported, since the enclosing deletion removes it.
 */
public class ConditionalAnalyzer {

    private final List<String> targetAliases;
    private final ConditionClassifier classifier;
    private final DisabledRangeCollector rangeCollector = new DisabledRangeCollector();

    public ConditionalAnalyzer(Collection<String> targetAliases) {
        this.targetAliases = targetAliases.stream()
            .map(a -> a.toUpperCase(Locale.ROOT))
            .collect(Collectors.toList());
        this.classifier = new ConditionClassifier(targetAliases);
    }

    /**
     * @param directives every directive of the file, in source order
     */
    public AnalysisResult analyze(List<Directive> directives) {
        List<DirectiveBlock> blocks = new ArrayList<>();
        List<AnalysisIssue> issues = new ArrayList<>();

        for (int i = 0; i < directives.size(); i++) {
            Directive opener = directives.get(i);
            if (opener.kind() != DirectiveKind.IF || !isTargetRelevant(opener)) continue;

            if (!opener.hasCondition()) {
                issues.add(issue(opener, "Invalid preprocessor expression - left untouched"));
                continue;
            }

            DirectiveBlock block = buildBlock(i, directives);
            if (block == null) {
                issues.add(issue(opener, "Unmatched #if directive"));
                continue;
            }

            if (block.hasElif()) {
                issues.add(issue(opener, "Complex conditional with #elif - requires manual review"));
            }
            if (block.booleanExpression()) {
                issues.add(issue(opener, "Boolean expression (&&/||) - requires manual review"));
            }
            if (block.negatedBoolean()) {
                issues.add(issue(opener, "Negated boolean expression - requires manual review"));
            }
            if (block.irregular()) {
                issues.add(issue(opener, "Unsupported conditional pattern - requires manual review"));
            }

            blocks.add(block.withDisabledSpans(rangeCollector.collect(block)));
        }

        // blocks and issues inside another block's dead branch go away with it
        List<TextSpan> dead = blocks.stream()
            .flatMap(b -> b.disabledSpans().stream())
            .collect(Collectors.toList());
        blocks.removeIf(b -> isInside(b.ifDirective().hashOffset(), dead));
        issues.removeIf(i -> isInside(i.offset(), dead));

        return new AnalysisResult(blocks, issues);
    }

    private static boolean isInside(int offset, List<TextSpan> spans) {
        for (TextSpan span : spans) {
            if (offset >= span.start() && offset < span.end()) return true;
        }
        return false;
    }

    boolean isTargetRelevant(Directive opener) {
        String condition = opener.argument().toUpperCase(Locale.ROOT);
        return targetAliases.stream().anyMatch(condition::contains);
    }

    private DirectiveBlock buildBlock(int openerIndex, List<Directive> directives) {
        Directive opener = directives.get(openerIndex);
        Directive elseDirective = null;
        List<Directive> elifs = new ArrayList<>();
        Directive endIf = null;

        int depth = 1;
        for (int i = openerIndex + 1; i < directives.size() && depth > 0; i++) {
            Directive d = directives.get(i);
            switch (d.kind()) {
                case IF -> depth++;
                case ELIF -> {
                    if (depth == 1 && elseDirective == null) elifs.add(d);
                }
                case ELSE -> {
                    if (depth == 1 && elseDirective == null) elseDirective = d;
                }
                case ENDIF -> {
                    depth--;
                    if (depth == 0) endIf = d;
                }
                case OTHER -> { }
            }
        }
        if (endIf == null) {
            return null;
        }

        ConditionShape shape = classifier.classify(opener.condition());
        return new DirectiveBlock(opener, elseDirective, elifs, endIf,
            shape.bareNegation(), shape.negatedBoolean(), shape.containsBoolean(), shape.irregular(),
            List.of());
    }

    private static AnalysisIssue issue(Directive directive, String message) {
        return new AnalysisIssue(directive.line(), directive.hashOffset(), message);
    }
}
