package com.directiveremover.core.verify;

import com.directiveremover.core.analysis.AnalysisIssue;
import com.directiveremover.core.analysis.DirectiveBlock;
import com.directiveremover.core.rewrite.SourceEdits;

import java.util.List;

/**
 * Terminal state of the {@link VerificationGate}.
 *
 * @param text       original text with every accepted block rewritten
 * @param edits      the edits that produce {@code text} from the original
 * @param accepted   blocks whose rewrite was kept, in source order
 * @param rejected   blocks whose rewrite introduced syntax errors
 * @param batchAccepted true when the single whole-file attempt succeeded
 * @param issues     one issue per rejected block
 */
public record GateOutcome(
    String text,
    SourceEdits edits,
    List<DirectiveBlock> accepted,
    List<DirectiveBlock> rejected,
    boolean batchAccepted,
    List<AnalysisIssue> issues
) {

    public GateOutcome {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
        issues = List.copyOf(issues);
    }
}
