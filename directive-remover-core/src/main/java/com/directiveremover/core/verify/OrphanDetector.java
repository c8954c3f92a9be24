package com.directiveremover.core.verify;

import com.directiveremover.core.scan.Directive;
import com.directiveremover.core.scan.SourceScanner;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Final structural check over the rewritten text: every {@code #elif}, {@code #else}
 * and {@code #endif} has an open {@code #if}, and every {@code #if} is closed.
 */
public class OrphanDetector {

    private final SourceScanner scanner;

    public OrphanDetector(Collection<String> definedSymbols) {
        this.scanner = new SourceScanner(definedSymbols);
    }

    public List<OrphanedDirective> detect(String text) {
        return detect(scanner.scan(text).directives());
    }

    public List<OrphanedDirective> detect(List<Directive> directives) {
        List<OrphanedDirective> orphans = new ArrayList<>();
        Deque<Directive> open = new ArrayDeque<>();

        for (Directive d : directives) {
            switch (d.kind()) {
                case IF -> open.push(d);
                case ELIF, ELSE -> {
                    if (open.isEmpty()) {
                        orphans.add(new OrphanedDirective(d.line(), "#" + d.keyword() + " without matching #if"));
                    }
                }
                case ENDIF -> {
                    if (open.isEmpty()) {
                        orphans.add(new OrphanedDirective(d.line(), "#endif without matching #if"));
                    } else {
                        open.pop();
                    }
                }
                case OTHER -> { }
            }
        }

        // innermost last, so the list stays in line order
        List<OrphanedDirective> unclosed = new ArrayList<>();
        for (Directive d : open) {
            unclosed.add(0, new OrphanedDirective(d.line(), "#if without matching #endif"));
        }
        orphans.addAll(unclosed);
        return orphans;
    }
}
