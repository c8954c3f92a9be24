package com.directiveremover.core;

import com.directiveremover.core.analysis.AnalysisIssue;
import com.directiveremover.core.analysis.AnalysisResult;
import com.directiveremover.core.analysis.BlockComplexity;
import com.directiveremover.core.analysis.ConditionalAnalyzer;
import com.directiveremover.core.analysis.DirectiveBlock;
import com.directiveremover.core.analysis.TargetSymbols;
import com.directiveremover.core.scan.SourceScanner;
import com.directiveremover.core.scan.TextSpan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalAnalyzerTest {

    private static final List<String> TARGET = TargetSymbols.of("NET8_0_OR_GREATER");

    private static AnalysisResult analyze(String text) {
        return new ConditionalAnalyzer(TARGET).analyze(new SourceScanner(TARGET).scan(text).directives());
    }

    private static List<String> issueMessages(AnalysisResult result) {
        return result.issues().stream().map(AnalysisIssue::message).collect(Collectors.toList());
    }

    @Test
    void simpleBlockWithElse() {
        AnalysisResult result = analyze("#if NET8_0_OR_GREATER\nA\n#else\nB\n#endif\n");

        assertEquals(1, result.blocks().size());
        DirectiveBlock block = result.blocks().get(0);
        assertEquals(BlockComplexity.SIMPLE, block.complexity());
        assertTrue(block.hasElse());
        assertFalse(block.hasElif());
        assertEquals(3, block.elseDirective().line());
        assertEquals(5, block.endIfDirective().line());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void nonTargetConditionalsAreIgnored() {
        AnalysisResult result = analyze("#if DEBUG\nA\n#else\nB\n#endif\n");

        assertTrue(result.blocks().isEmpty());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void aliasAndCaseVariantsAreTargetRelevant() {
        AnalysisResult result = analyze("#if NET_8_0_OR_GREATER\nA\n#endif\n#if !net8_0_or_greater\nB\n#endif\n");

        assertEquals(2, result.blocks().size());
        assertEquals(BlockComplexity.SIMPLE, result.blocks().get(0).complexity());
        assertEquals(BlockComplexity.NEGATED, result.blocks().get(1).complexity());
    }

    @Test
    void pairsSiblingsByDepth() {
        String text = "#if NET8_0_OR_GREATER\n#if DEBUG\nA\n#else\nB\n#endif\n#else\nC\n#endif\n";
        AnalysisResult result = analyze(text);

        assertEquals(1, result.blocks().size());
        DirectiveBlock block = result.blocks().get(0);
        assertEquals(7, block.elseDirective().line());
        assertEquals(9, block.endIfDirective().line());
    }

    @Test
    void nestedTargetBlocksAreEachReported() {
        String text = "#if NET8_0_OR_GREATER\n#if !NET8_0_OR_GREATER\nA\n#endif\n#endif\n";
        AnalysisResult result = analyze(text);

        assertEquals(2, result.blocks().size());
        assertEquals(5, result.blocks().get(0).endIfDirective().line());
        assertEquals(4, result.blocks().get(1).endIfDirective().line());
    }

    @Test
    void blocksInDeadBranchAreDroppedWithTheirIssues() {
        String text = "#if !NET8_0_OR_GREATER\n#if NET8_0_OR_GREATER && DEBUG\nA\n#endif\n#endif\n";
        AnalysisResult result = analyze(text);

        assertEquals(1, result.blocks().size());
        assertEquals(1, result.blocks().get(0).line());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void elifMakesBlockComplex() {
        AnalysisResult result = analyze("#if NET8_0_OR_GREATER\nA\n#elif DEBUG\nB\n#else\nC\n#endif\n");

        DirectiveBlock block = result.blocks().get(0);
        assertEquals(BlockComplexity.COMPLEX, block.complexity());
        assertEquals(1, block.elifDirectives().size());
        assertTrue(block.disabledSpans().isEmpty());
        assertEquals(List.of("Complex conditional with #elif - requires manual review"), issueMessages(result));
    }

    @Test
    void booleanExpressionMakesBlockComplex() {
        AnalysisResult result = analyze("#if NET8_0_OR_GREATER && DEBUG\nA\n#endif\n");

        assertEquals(BlockComplexity.COMPLEX, result.blocks().get(0).complexity());
        assertEquals(List.of("Boolean expression (&&/||) - requires manual review"), issueMessages(result));
    }

    @Test
    void negatedBooleanMakesBlockComplex() {
        AnalysisResult result = analyze("#if !(NET8_0_OR_GREATER || DEBUG)\nA\n#endif\n");

        DirectiveBlock block = result.blocks().get(0);
        assertEquals(BlockComplexity.COMPLEX, block.complexity());
        assertTrue(block.negatedBoolean());
        assertFalse(block.booleanExpression());
        assertEquals(List.of("Negated boolean expression - requires manual review"), issueMessages(result));
    }

    @Test
    void comparisonIsUnsupportedPattern() {
        AnalysisResult result = analyze("#if NET8_0_OR_GREATER == false\nA\n#endif\n");

        assertEquals(BlockComplexity.COMPLEX, result.blocks().get(0).complexity());
        assertEquals(List.of("Unsupported conditional pattern - requires manual review"), issueMessages(result));
    }

    @Test
    void unmatchedOpenerYieldsIssueAndNoBlock() {
        AnalysisResult result = analyze("#if NET8_0_OR_GREATER\nA\n");

        assertTrue(result.blocks().isEmpty());
        assertEquals(1, result.issues().size());
        assertEquals("Unmatched #if directive", result.issues().get(0).message());
        assertEquals(1, result.issues().get(0).line());
    }

    @Test
    void unparsableConditionIsLeftUntouched() {
        AnalysisResult result = analyze("#if NET8_0_OR_GREATER &&\nA\n#endif\n");

        assertTrue(result.blocks().isEmpty());
        assertEquals(List.of("Invalid preprocessor expression - left untouched"), issueMessages(result));
    }

    @Test
    void targetTextInsideStringIsNotADirective() {
        AnalysisResult result = analyze("var s = @\"\n#if NET8_0_OR_GREATER\n#endif\n\";\n");

        assertTrue(result.blocks().isEmpty());
    }

    @Test
    void simpleBlockCarriesElseBranchSpan() {
        // "#if NET8_0_OR_GREATER\n" is 22 characters
        AnalysisResult result = analyze("#if NET8_0_OR_GREATER\nA\n#else\nB\n#endif\n");

        assertEquals(List.of(new TextSpan(30, 32)), result.blocks().get(0).disabledSpans());
    }
}
