package com.directiveremover.core;

import com.directiveremover.core.analysis.AnalysisIssue;
import com.directiveremover.core.analysis.AnalysisResult;
import com.directiveremover.core.analysis.ConditionalAnalyzer;
import com.directiveremover.core.analysis.DirectiveBlock;
import com.directiveremover.core.analysis.TargetSymbols;
import com.directiveremover.core.rewrite.ReviewMarkerInjector;
import com.directiveremover.core.rewrite.SourceEdits;
import com.directiveremover.core.scan.ScanResult;
import com.directiveremover.core.scan.SourceScanner;
import com.directiveremover.core.verify.GateOutcome;
import com.directiveremover.core.verify.OrphanDetector;
import com.directiveremover.core.verify.OrphanedDirective;
import com.directiveremover.core.verify.ScanningSyntaxVerifier;
import com.directiveremover.core.verify.SyntaxVerifier;
import com.directiveremover.core.verify.VerificationGate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Removes every conditional bound to one target symbol from a C# source text,
 * assuming the symbol is defined.
 *
 * Pipeline: scan, build and classify blocks, rewrite simple and negated blocks
 * through the verification gate, mark complex and rejected blocks for review,
 * then check the result for orphaned directives. An orphan discards the whole
 * rewrite. Instances hold no per-text state and may be shared between threads.
 */
public class ConditionalRemover {

    private final List<String> targetAliases;
    private final SourceScanner scanner;
    private final ConditionalAnalyzer analyzer;
    private final VerificationGate gate;
    private final ReviewMarkerInjector markerInjector = new ReviewMarkerInjector();
    private final OrphanDetector orphanDetector;

    public ConditionalRemover(String targetSymbol, Collection<String> additionalDefines) {
        this(targetSymbol, additionalDefines, null);
    }

    /**
     * @param verifier parser used by the verification gate; null for the default scanner-based one
     */
    public ConditionalRemover(String targetSymbol, Collection<String> additionalDefines, SyntaxVerifier verifier) {
        this.targetAliases = TargetSymbols.of(targetSymbol);
        Set<String> defined = new LinkedHashSet<>(targetAliases);
        defined.addAll(additionalDefines);

        this.scanner = new SourceScanner(defined);
        this.analyzer = new ConditionalAnalyzer(targetAliases);
        this.gate = new VerificationGate(verifier != null ? verifier : new ScanningSyntaxVerifier(defined));
        this.orphanDetector = new OrphanDetector(defined);
    }

    public List<String> targetAliases() {
        return targetAliases;
    }

    public RemovalResult process(String text) {
        ScanResult scan = scanner.scan(text);
        AnalysisResult analysis = analyzer.analyze(scan.directives());

        List<DirectiveBlock> candidates = new ArrayList<>();
        List<DirectiveBlock> complex = new ArrayList<>();
        for (DirectiveBlock block : analysis.blocks()) {
            if (block.isComplex()) {
                complex.add(block);
            } else {
                candidates.add(block);
            }
        }

        GateOutcome outcome = gate.run(text, candidates);

        SourceEdits markers = markerInjector.plan(text, complex, outcome.rejected());
        String result = outcome.edits().merge(markers).apply(text);

        List<AnalysisIssue> issues = new ArrayList<>(analysis.issues());
        issues.addAll(outcome.issues());
        issues.sort(Comparator.comparingInt(AnalysisIssue::line));

        List<OrphanedDirective> orphans = orphanDetector.detect(result);
        if (!orphans.isEmpty()) {
            List<String> errors = orphans.stream()
                .map(OrphanedDirective::toString)
                .collect(Collectors.toList());
            return RemovalResult.failure(text, issues, errors);
        }

        int flagged = complex.size() + outcome.rejected().size();
        return new RemovalResult(result, false, outcome.accepted().size(), flagged, issues,
            List.of(), !result.equals(text));
    }
}
