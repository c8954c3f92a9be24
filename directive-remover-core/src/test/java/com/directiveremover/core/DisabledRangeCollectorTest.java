package com.directiveremover.core;

import com.directiveremover.core.analysis.ConditionalAnalyzer;
import com.directiveremover.core.analysis.DirectiveBlock;
import com.directiveremover.core.scan.SourceScanner;
import com.directiveremover.core.scan.TextSpan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DisabledRangeCollectorTest {

    private static final List<String> TARGET = List.of("T");

    private static List<DirectiveBlock> blocks(String text) {
        return new ConditionalAnalyzer(TARGET).analyze(new SourceScanner(TARGET).scan(text).directives()).blocks();
    }

    private static List<String> spanTexts(String text, DirectiveBlock block) {
        return block.disabledSpans().stream().map(s -> s.of(text)).collect(Collectors.toList());
    }

    @Test
    void simpleWithoutElseHasNoSpans() {
        assertTrue(blocks("#if T\nA\n#endif\n").get(0).disabledSpans().isEmpty());
    }

    @Test
    void simpleWithElseCoversElseBranch() {
        String text = "#if T\nA\n#else\nB\n#endif\n";

        assertEquals(List.of(new TextSpan(14, 16)), blocks(text).get(0).disabledSpans());
    }

    @Test
    void negatedWithoutElseCoversWholeBody() {
        String text = "#if !T\nA\nA2\n#endif\nC\n";

        assertEquals(List.of("A\nA2\n"), spanTexts(text, blocks(text).get(0)));
    }

    @Test
    void negatedWithElseStopsAtElse() {
        String text = "#if !T\nA\n#else\nB\n#endif\n";

        assertEquals(List.of(new TextSpan(7, 9)), blocks(text).get(0).disabledSpans());
    }

    @Test
    void complexBlockHasNoSpans() {
        assertTrue(blocks("#if T || D\nA\n#else\nB\n#endif\n").get(0).disabledSpans().isEmpty());
    }

    @Test
    void deadBranchIncludesNestedConditionalsAndDirectives() {
        String text = "#if T\nA\n#else\nB\n#if DEBUG\nX\n#else\nY\n#endif\nC\n#region r\nD\n#endregion\n#endif\n";

        assertEquals(List.of("B\n#if DEBUG\nX\n#else\nY\n#endif\nC\n#region r\nD\n#endregion\n"),
            spanTexts(text, blocks(text).get(0)));
    }

    @Test
    void negatedBodyIncludesNestedConditionals() {
        String text = "#if !T\n#if DEBUG\nX\n#endif\n#endif\nC\n";

        assertEquals(List.of("#if DEBUG\nX\n#endif\n"), spanTexts(text, blocks(text).get(0)));
    }

    @Test
    void targetBlockInDeadBranchIsNotReported() {
        String text = "#if T\nA\n#else\n#if T\nB\n#else\nC\n#endif\n#endif\n";
        List<DirectiveBlock> blocks = blocks(text);

        assertEquals(1, blocks.size());
        assertEquals(List.of("#if T\nB\n#else\nC\n#endif\n"), spanTexts(text, blocks.get(0)));
    }

    @Test
    void emptyDeadBranchHasNoSpan() {
        assertTrue(blocks("#if T\nA\n#else\n#endif\n").get(0).disabledSpans().isEmpty());
    }

    @Test
    void crlfSpansEndBeforeCloserLine() {
        String text = "#if !T\r\nA\r\n#endif\r\n";

        assertEquals(List.of("A\r\n"), spanTexts(text, blocks(text).get(0)));
    }
}
