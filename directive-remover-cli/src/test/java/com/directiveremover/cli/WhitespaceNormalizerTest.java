package com.directiveremover.cli;

import com.directiveremover.cli.io.LineEnding;
import com.directiveremover.cli.io.WhitespaceNormalizer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WhitespaceNormalizerTest {

    @Test
    void collapsesRunsOfBlankLines() {
        assertEquals("a\n\nb\n", WhitespaceNormalizer.normalize("a\n\n\n\nb\n", LineEnding.LF));
    }

    @Test
    void keepsSingleBlankLine() {
        assertEquals("a\n\nb\n", WhitespaceNormalizer.normalize("a\n\nb\n", LineEnding.LF));
    }

    @Test
    void trimsTrailingWhitespace() {
        assertEquals("class A\n{\n    int x;\n}\n",
            WhitespaceNormalizer.normalize("class A  \n{\t\n    int x;   \n}\n", LineEnding.LF));
    }

    @Test
    void keepsLeadingIndentation() {
        assertEquals("    int x;", WhitespaceNormalizer.normalize("    int x;", LineEnding.LF));
    }

    @Test
    void unifiesLineBreaksToRequestedStyle() {
        assertEquals("a\r\n\r\nb\r\nc\r\n",
            WhitespaceNormalizer.normalize("a\r\n\r\n\r\nb\nc\r\n", LineEnding.CRLF));
    }

    @Test
    void whitespaceOnlyLinesAreTrimmedButNotCollapsed() {
        assertEquals("a\n\n\nb", WhitespaceNormalizer.normalize("a\n  \n  \nb", LineEnding.LF));
    }
}
