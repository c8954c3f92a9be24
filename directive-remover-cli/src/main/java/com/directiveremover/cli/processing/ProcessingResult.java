package com.directiveremover.cli.processing;

import com.directiveremover.core.analysis.AnalysisIssue;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of processing one file.
 *
 * @param errors  failure reasons, or the skip reason for {@link ResultStatus#SKIPPED}
 * @param preview would-be file content in dry-run mode, null otherwise
 */
public record ProcessingResult(
    Path path,
    ResultStatus status,
    int blocksRemoved,
    int blocksFlagged,
    List<AnalysisIssue> issues,
    List<String> errors,
    String preview
) {

    public ProcessingResult {
        issues = List.copyOf(issues);
        errors = List.copyOf(errors);
    }

    public static ProcessingResult success(Path path, int blocksRemoved, int blocksFlagged,
                                           List<AnalysisIssue> issues, String preview) {
        ResultStatus status = blocksFlagged > 0 ? ResultStatus.SUCCESS_WITH_REVIEW : ResultStatus.SUCCESS;
        return new ProcessingResult(path, status, blocksRemoved, blocksFlagged, issues, List.of(), preview);
    }

    public static ProcessingResult failed(Path path, List<String> errors, List<AnalysisIssue> issues) {
        return new ProcessingResult(path, ResultStatus.FAILED, 0, 0, issues, errors, null);
    }

    public static ProcessingResult skipped(Path path, String reason) {
        return new ProcessingResult(path, ResultStatus.SKIPPED, 0, 0, List.of(), List.of(reason), null);
    }

    public boolean isFailed() {
        return status == ResultStatus.FAILED;
    }
}
