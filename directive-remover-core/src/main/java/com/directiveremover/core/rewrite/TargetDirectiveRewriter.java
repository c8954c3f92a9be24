package com.directiveremover.core.rewrite;

import com.directiveremover.core.analysis.DirectiveBlock;
import com.directiveremover.core.scan.TextSpan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Removes simple and negated target blocks: their directive lines, terminators
 * included, and their dead spans. Everything else is copied byte for byte.
 */
public class TargetDirectiveRewriter {

    /**
     * @throws IllegalArgumentException if any block is complex
     */
    public SourceEdits plan(Collection<DirectiveBlock> blocks) {
        List<TextSpan> deletions = new ArrayList<>();
        for (DirectiveBlock block : blocks) {
            if (block.isComplex()) {
                throw new IllegalArgumentException("Complex block cannot be rewritten: " + block.ifDirective());
            }
            deletions.addAll(block.directiveLines());
            deletions.addAll(block.disabledSpans());
        }
        return SourceEdits.deleting(deletions);
    }

    public String rewrite(String text, Collection<DirectiveBlock> blocks) {
        return plan(blocks).apply(text);
    }
}
