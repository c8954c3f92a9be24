package com.directiveremover.core;

import com.directiveremover.core.analysis.AnalysisIssue;

import java.util.List;

/**
 * Outcome of {@link ConditionalRemover#process}.
 *
 * @param text          the rewritten text, or the input unchanged when {@code failed}
 * @param failed        true when the rewrite was discarded
 * @param blocksRemoved blocks rewritten away
 * @param blocksFlagged blocks left in place under a review marker
 * @param issues        advisory diagnostics, in line order
 * @param errors        reasons for failure; empty unless {@code failed}
 * @param changed       whether {@code text} differs from the input
 */
public record RemovalResult(
    String text,
    boolean failed,
    int blocksRemoved,
    int blocksFlagged,
    List<AnalysisIssue> issues,
    List<String> errors,
    boolean changed
) {

    public RemovalResult {
        issues = List.copyOf(issues);
        errors = List.copyOf(errors);
    }

    static RemovalResult failure(String original, List<AnalysisIssue> issues, List<String> errors) {
        return new RemovalResult(original, true, 0, 0, issues, errors, false);
    }

    public boolean needsReview() {
        return blocksFlagged > 0;
    }
}
