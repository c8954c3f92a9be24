package com.directiveremover.cli.report;

import com.directiveremover.cli.processing.ProcessingResult;
import com.directiveremover.cli.processing.ResultStatus;
import com.directiveremover.core.analysis.AnalysisIssue;
import com.directiveremover.core.rewrite.ReviewMarkerInjector;

import java.io.PrintStream;
import java.util.List;

/**
 * User-facing console output: one line per file and a closing summary.
 */
public class ResultPrinter {

    private static final String RULE = "=".repeat(55);

    private final PrintStream out;
    private final boolean verbose;

    public ResultPrinter(PrintStream out, boolean verbose) {
        this.out = out;
        this.verbose = verbose;
    }

    public void printHeader(int fileCount, boolean dryRun, boolean backup) {
        out.println("Found " + fileCount + " files to process");
        if (dryRun) out.println("(dry-run mode - no files will be modified)");
        if (backup) out.println("(backup mode - .bak files will be created)");
        out.println();
    }

    public void printResult(ProcessingResult result) {
        switch (result.status()) {
            case SUCCESS -> out.println("  OK " + result.path() + " (" + result.blocksRemoved() + " cleaned)");
            case SUCCESS_WITH_REVIEW -> {
                out.println("  REVIEW " + result.path() + " (" + result.blocksRemoved() + " cleaned, "
                    + result.blocksFlagged() + " need review)");
                if (verbose) {
                    for (AnalysisIssue issue : result.issues()) {
                        out.println("    -> " + issue.message() + " at line " + issue.line());
                    }
                }
            }
            case FAILED -> {
                out.println("  FAIL " + result.path());
                for (String error : result.errors()) {
                    out.println("    " + error);
                }
            }
            case SKIPPED -> {
                if (verbose) out.println("  SKIP " + result.path());
            }
        }
    }

    public void printSummary(List<ProcessingResult> results) {
        int cleaned = results.stream().mapToInt(ProcessingResult::blocksRemoved).sum();
        int flagged = results.stream().mapToInt(ProcessingResult::blocksFlagged).sum();
        long failed = results.stream().filter(r -> r.status() == ResultStatus.FAILED).count();

        out.println();
        out.println(RULE);
        out.println("  Files processed:     " + results.size());
        out.println("  Blocks cleaned:      " + cleaned);
        out.println("  Blocks need review:  " + flagged + " (#error injected)");
        out.println("  Files failed:        " + failed);
        out.println(RULE);

        if (flagged > 0) {
            out.println();
            out.println("Warning: " + flagged + " complex blocks have #error directives injected.");
            out.println("  Build will fail until these are manually reviewed and resolved.");
            out.println();
            out.println("  To find them: grep -rn '" + ReviewMarkerInjector.SENTINEL + "' --include='*.cs'");
        }
    }

    public void printPreview(ProcessingResult result) {
        if (result.preview() == null) return;
        out.println("--- " + result.path() + " (preview)");
        out.println(result.preview());
    }
}
