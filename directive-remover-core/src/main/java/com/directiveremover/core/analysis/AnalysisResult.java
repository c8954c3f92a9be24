package com.directiveremover.core.analysis;

import java.util.List;

public record AnalysisResult(List<DirectiveBlock> blocks, List<AnalysisIssue> issues) {

    public AnalysisResult {
        blocks = List.copyOf(blocks);
        issues = List.copyOf(issues);
    }
}
