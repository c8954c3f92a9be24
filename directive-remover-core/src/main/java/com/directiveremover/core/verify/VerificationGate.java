package com.directiveremover.core.verify;

import com.directiveremover.core.analysis.AnalysisIssue;
import com.directiveremover.core.analysis.DirectiveBlock;
import com.directiveremover.core.rewrite.ReviewMarkerInjector;
import com.directiveremover.core.rewrite.SourceEdits;
import com.directiveremover.core.rewrite.TargetDirectiveRewriter;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies candidate blocks and keeps only rewrites that still parse.
 *
 * <pre>
 *   ATTEMPT_BATCH --ok--> DONE
 *        |
 *      errors
 *        v
 *      RETRY --> PER_BLOCK(0) --> ... --> PER_BLOCK(n-1) --> DONE
 * </pre>
 *
 * A candidate text is acceptable when it has no more syntax errors than the
 * original, not counting errors raised by review markers. Every per-block attempt
 * applies the blocks accepted so far plus the candidate to the original text.
 */
public class VerificationGate {

    enum State { ATTEMPT_BATCH, RETRY, PER_BLOCK, DONE }

    private final SyntaxVerifier verifier;
    private final TargetDirectiveRewriter rewriter;

    public VerificationGate(SyntaxVerifier verifier) {
        this(verifier, new TargetDirectiveRewriter());
    }

    public VerificationGate(SyntaxVerifier verifier, TargetDirectiveRewriter rewriter) {
        this.verifier = verifier;
        this.rewriter = rewriter;
    }

    /**
     * @param original   text the blocks were located in
     * @param candidates simple and negated blocks, in source order
     */
    public GateOutcome run(String original, List<DirectiveBlock> candidates) {
        List<DirectiveBlock> accepted = new ArrayList<>();
        List<DirectiveBlock> rejected = new ArrayList<>();
        List<AnalysisIssue> issues = new ArrayList<>();
        String current = original;
        SourceEdits currentEdits = SourceEdits.empty();
        boolean batchAccepted = false;
        int baseline = 0;
        int next = 0;

        State state = candidates.isEmpty() ? State.DONE : State.ATTEMPT_BATCH;
        while (state != State.DONE) {
            switch (state) {
                case ATTEMPT_BATCH -> {
                    baseline = countErrors(original);
                    SourceEdits edits = rewriter.plan(candidates);
                    String candidate = edits.apply(original);
                    if (countErrors(candidate) <= baseline) {
                        accepted.addAll(candidates);
                        current = candidate;
                        currentEdits = edits;
                        batchAccepted = true;
                        state = State.DONE;
                    } else {
                        state = State.RETRY;
                    }
                }
                case RETRY -> {
                    next = 0;
                    state = State.PER_BLOCK;
                }
                case PER_BLOCK -> {
                    DirectiveBlock block = candidates.get(next++);
                    List<DirectiveBlock> trial = new ArrayList<>(accepted);
                    trial.add(block);
                    SourceEdits edits = rewriter.plan(trial);
                    String candidate = edits.apply(original);
                    if (countErrors(candidate) <= baseline) {
                        accepted.add(block);
                        current = candidate;
                        currentEdits = edits;
                    } else {
                        rejected.add(block);
                        issues.add(new AnalysisIssue(block.line(), block.ifDirective().hashOffset(),
                            "Transformation caused compilation error - requires manual review"));
                    }
                    state = next < candidates.size() ? State.PER_BLOCK : State.DONE;
                }
                default -> throw new IllegalStateException("Unexpected gate state: " + state);
            }
        }

        return new GateOutcome(current, currentEdits, accepted, rejected, batchAccepted, issues);
    }

    private int countErrors(String text) {
        return (int) verifier.verify(text).stream()
            .filter(d -> !ReviewMarkerInjector.isMarkerMessage(d.message()))
            .count();
    }
}
