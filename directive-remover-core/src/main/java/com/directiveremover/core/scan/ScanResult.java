package com.directiveremover.core.scan;

import java.util.List;

/**
 * Output of one {@link SourceScanner} pass: directives in source order plus syntax errors.
 */
public record ScanResult(
    List<Directive> directives,
    List<SyntaxDiagnostic> diagnostics
) {
    public ScanResult {
        directives = List.copyOf(directives);
        diagnostics = List.copyOf(diagnostics);
    }
}
