package com.directiveremover.core;

import com.directiveremover.core.verify.OrphanDetector;
import com.directiveremover.core.verify.OrphanedDirective;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrphanDetectorTest {

    private final OrphanDetector detector = new OrphanDetector(List.of("T"));

    @Test
    void balancedTextHasNoOrphans() {
        assertTrue(detector.detect("#if T\n#if D\n#elif E\n#else\n#endif\n#endif\n").isEmpty());
    }

    @Test
    void elseWithoutIf() {
        List<OrphanedDirective> orphans = detector.detect("A\n#else\nB\n");

        assertEquals(List.of(new OrphanedDirective(2, "#else without matching #if")), orphans);
        assertEquals("Orphaned directive at line 2: #else without matching #if", orphans.get(0).toString());
    }

    @Test
    void endifAndElifWithoutIf() {
        List<OrphanedDirective> orphans = detector.detect("x\n#endif\n#elif Y\n");

        assertEquals(2, orphans.size());
        assertEquals("#endif without matching #if", orphans.get(0).message());
        assertEquals(3, orphans.get(1).line());
        assertEquals("#elif without matching #if", orphans.get(1).message());
    }

    @Test
    void unclosedOpenersReportedInLineOrder() {
        List<OrphanedDirective> orphans = detector.detect("#if A\n#if B\n#if C\n#endif\n");

        assertEquals(List.of(
            new OrphanedDirective(1, "#if without matching #endif"),
            new OrphanedDirective(2, "#if without matching #endif")), orphans);
    }

    @Test
    void directivesInCommentsAreNotCounted() {
        assertTrue(detector.detect("/*\n#endif\n*/\nint x; // #else\n").isEmpty());
    }
}
