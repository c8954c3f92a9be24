package com.directiveremover.core.analysis;

import com.directiveremover.core.scan.TextSpan;

import java.util.Collections;
import java.util.List;

/**
 * Computes the dead text of a block under the assumption that the target symbol is defined.
 *
 * <ul>
 *   <li>{@code #if T} without else: nothing, the guarded text stays.</li>
 *   <li>{@code #if T ... #else ... #endif}: from the end of the else line to the start of the endif line.</li>
 *   <li>{@code #if !T}: from the end of the opener to the else line, or to the endif line without an else.</li>
 *   <li>Complex blocks: nothing.</li>
 * </ul>
 *
 * A dead branch is removed whole, nested conditionals and other directive lines
 * included: nothing inside it is ever compiled once the target is defined. Every
 * conditional nested in a dead branch closes inside it, so the deletion cannot
 * leave an orphaned directive behind.
 */
public class DisabledRangeCollector {

    public List<TextSpan> collect(DirectiveBlock block) {
        if (block.isComplex()) {
            return Collections.emptyList();
        }

        int start;
        int end;
        if (block.negated()) {
            start = block.ifDirective().lineEnd();
            end = block.hasElse()
                ? block.elseDirective().lineStart()
                : block.endIfDirective().lineStart();
        } else if (block.hasElse()) {
            start = block.elseDirective().lineEnd();
            end = block.endIfDirective().lineStart();
        } else {
            return Collections.emptyList();
        }
        return end > start ? List.of(new TextSpan(start, end)) : Collections.emptyList();
    }
}
