package com.directiveremover.core.rewrite;

import com.directiveremover.core.analysis.DirectiveBlock;
import com.directiveremover.core.scan.Directive;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Puts an {@code #error} line carrying {@link #SENTINEL} above each block that was
 * left in place, so the build fails until someone resolves it. The block itself is
 * not touched.
 */
public class ReviewMarkerInjector {

    public static final String SENTINEL = "CONDITIONAL_REVIEW_REQUIRED";

    static final String REASON_COMPILATION = "Transformation caused compilation error";
    static final String REASON_ELIF = "Complex conditional with #elif branches";
    static final String REASON_BOOLEAN = "Boolean expression (&&/||) requires manual simplification";
    static final String REASON_OTHER = "Complex conditional pattern";

    /**
     * @param text           the original text the blocks were located in
     * @param complexBlocks  blocks flagged by classification
     * @param rejectedBlocks blocks whose rewrite broke the parse
     */
    public SourceEdits plan(String text, Collection<DirectiveBlock> complexBlocks,
                            Collection<DirectiveBlock> rejectedBlocks) {
        List<SourceEdits.Insertion> markers = new ArrayList<>();
        for (DirectiveBlock block : complexBlocks) {
            markers.add(marker(text, block, false));
        }
        for (DirectiveBlock block : rejectedBlocks) {
            markers.add(marker(text, block, true));
        }
        return SourceEdits.inserting(markers);
    }

    public String inject(String text, Collection<DirectiveBlock> complexBlocks,
                         Collection<DirectiveBlock> rejectedBlocks) {
        return plan(text, complexBlocks, rejectedBlocks).apply(text);
    }

    public static String reasonFor(DirectiveBlock block, boolean compilationFailed) {
        if (compilationFailed) return REASON_COMPILATION;
        if (block.hasElif()) return REASON_ELIF;
        if (block.booleanExpression()) return REASON_BOOLEAN;
        return REASON_OTHER;
    }

    /** True for a diagnostic raised by one of our own markers. */
    public static boolean isMarkerMessage(String message) {
        return message != null && message.contains(SENTINEL);
    }

    private static SourceEdits.Insertion marker(String text, DirectiveBlock block, boolean compilationFailed) {
        Directive opener = block.ifDirective();
        String terminator = opener.terminator().isEmpty() ? "\n" : opener.terminator();
        String line = opener.indent(text) + "#error " + SENTINEL + ": "
            + reasonFor(block, compilationFailed) + terminator;
        return new SourceEdits.Insertion(opener.lineStart(), line);
    }
}
