package com.directiveremover.core.verify;

import com.directiveremover.core.scan.SyntaxDiagnostic;

import java.util.List;

/**
 * Parses a candidate text and returns its syntax errors. An empty list means the text parses.
 */
@FunctionalInterface
public interface SyntaxVerifier {

    List<SyntaxDiagnostic> verify(String text);
}
