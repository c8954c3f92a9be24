package com.directiveremover.core.verify;

import com.directiveremover.core.scan.SourceScanner;
import com.directiveremover.core.scan.SyntaxDiagnostic;

import java.util.Collection;
import java.util.List;

/**
 * Verifies by running the {@link SourceScanner} with the given defined symbols.
 */
public class ScanningSyntaxVerifier implements SyntaxVerifier {

    private final SourceScanner scanner;

    public ScanningSyntaxVerifier(Collection<String> definedSymbols) {
        this.scanner = new SourceScanner(definedSymbols);
    }

    @Override
    public List<SyntaxDiagnostic> verify(String text) {
        return scanner.scan(text).diagnostics();
    }
}
