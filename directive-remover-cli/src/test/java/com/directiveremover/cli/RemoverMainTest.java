package com.directiveremover.cli;

import com.directiveremover.cli.processing.ProcessingResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RemoverMainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(RemoverMain.UsageException.class, () -> RemoverMain.run(new String[]{}, out));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(RemoverMain.UsageException.class,
                () -> RemoverMain.run(new String[]{"src", "--foo"}, out));
    }

    @Test
    void flagWithoutArgumentThrowsUsageException() {
        Exception ex = assertThrows(RemoverMain.UsageException.class,
                () -> RemoverMain.run(new String[]{"src", "--target"}, out));
        assertTrue(ex.getMessage().contains("--target"));
    }

    @Test
    void twoPathsThrowUsageException() {
        assertThrows(RemoverMain.UsageException.class,
                () -> RemoverMain.run(new String[]{"a", "b"}, out));
    }

    @Test
    void onlyFlagsWithoutPathThrowsUsageException() {
        assertThrows(RemoverMain.UsageException.class,
                () -> RemoverMain.run(new String[]{"--dry-run", "--verbose"}, out));
    }

    @Test
    void blankTargetThrowsUsageException() {
        assertThrows(RemoverMain.UsageException.class,
                () -> RemoverMain.run(new String[]{"src", "--target", " "}, out));
    }

    @Test
    void executeMapsUsageErrorToExitCode64() {
        assertEquals(RemoverMain.EXIT_USAGE, RemoverMain.execute(new String[]{"--bogus"}, out));
    }

    @Test
    void executeMapsMissingPathToExitCode1(@TempDir Path tmp) {
        String missing = tmp.resolve("does-not-exist").toString();
        assertEquals(RemoverMain.EXIT_FAILED, RemoverMain.execute(new String[]{missing}, out));
    }

    @Test
    void rewritesSingleFileInPlace(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("Program.cs");
        Files.writeString(file, """
            class Program
            {
            #if NET8_0_OR_GREATER
                static void Modern() { }
            #else
                static void Legacy() { }
            #endif
            }
            """);

        int code = RemoverMain.run(new String[]{file.toString()}, out);

        assertEquals(RemoverMain.EXIT_OK, code);
        assertEquals("""
            class Program
            {
                static void Modern() { }
            }
            """, Files.readString(file));
        assertTrue(output().contains("Found 1 files to process"));
        assertTrue(output().contains("OK " + file + " (1 cleaned)"));
        assertTrue(output().contains("Blocks cleaned:      1"));
    }

    @Test
    void dryRunLeavesFileUntouched(@TempDir Path tmp) throws IOException {
        String source = """
            #if !NET8_0_OR_GREATER
            using Legacy;
            #endif
            class A { }
            """;
        Path file = tmp.resolve("A.cs");
        Files.writeString(file, source);

        int code = RemoverMain.run(new String[]{tmp.toString(), "--dry-run", "--verbose"}, out);

        assertEquals(RemoverMain.EXIT_OK, code);
        assertEquals(source, Files.readString(file));
        assertTrue(output().contains("(dry-run mode - no files will be modified)"));
        assertTrue(output().contains("--- " + file + " (preview)"));
        assertTrue(output().contains("class A { }"));
    }

    @Test
    void customTargetOnlyTouchesThatSymbol(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("A.cs");
        Files.writeString(file, """
            #if NET6_0_OR_GREATER
            class Six { }
            #endif
            #if NET8_0_OR_GREATER
            class Eight { }
            #endif
            """);

        RemoverMain.run(new String[]{file.toString(), "--target", "NET6_0_OR_GREATER"}, out);

        assertEquals("""
            class Six { }
            #if NET8_0_OR_GREATER
            class Eight { }
            #endif
            """, Files.readString(file));
    }

    @Test
    void failOnReviewReturnsExitCode2WhenBlocksAreFlagged(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("A.cs");
        Files.writeString(file, """
            #if NET8_0_OR_GREATER || NET7_0
            class A { }
            #endif
            """);

        int code = RemoverMain.run(new String[]{file.toString(), "--fail-on-review"}, out);

        assertEquals(RemoverMain.EXIT_REVIEW, code);
        assertTrue(Files.readString(file).startsWith(
            "#error CONDITIONAL_REVIEW_REQUIRED: Boolean expression (&&/||) requires manual simplification\n"));
        assertTrue(output().contains("REVIEW " + file + " (0 cleaned, 1 need review)"));
        assertTrue(output().contains("grep -rn 'CONDITIONAL_REVIEW_REQUIRED'"));
    }

    @Test
    void flaggedBlocksWithoutFailOnReviewExitZero(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("A.cs");
        Files.writeString(file, """
            #if NET8_0_OR_GREATER
            class A { }
            #elif NET6_0
            class B { }
            #endif
            """);

        assertEquals(RemoverMain.EXIT_OK, RemoverMain.run(new String[]{file.toString()}, out));
    }

    @Test
    void flagsOverrideConfigFile(@TempDir Path tmp) throws IOException {
        Path src = Files.createDirectories(tmp.resolve("src"));
        Path file = src.resolve("A.cs");
        String source = """
            #if NET8_0_OR_GREATER
            class A { }
            #endif
            """;
        Files.writeString(file, source);
        Path config = tmp.resolve("remover.json");
        Files.writeString(config, """
            { "target_symbol": "NET8_0_OR_GREATER", "backup": true }
            """);

        int code = RemoverMain.run(new String[]{src.toString(), "--config", config.toString(), "--dry-run"}, out);

        assertEquals(RemoverMain.EXIT_OK, code);
        assertEquals(source, Files.readString(file));
        assertFalse(Files.exists(src.resolve("A.cs.bak")), "dry-run never takes backups");
    }

    @Test
    void writesReportWhenRequested(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("A.cs");
        Files.writeString(file, """
            #if NET8_0_OR_GREATER
            class A { }
            #endif
            """);
        Path report = tmp.resolve("out/report.json");

        RemoverMain.run(new String[]{file.toString(), "--report", report.toString()}, out);

        assertTrue(Files.exists(report));
        String json = Files.readString(report);
        assertTrue(json.contains("\"target_symbol\": \"NET8_0_OR_GREATER\""));
        assertTrue(json.contains("\"blocks_cleaned\": 1"));
        assertTrue(output().contains("Report written to: " + report));
    }

    @Test
    void exitCodeIsFailedWhenAnyFileFailed() {
        List<ProcessingResult> results = List.of(
            ProcessingResult.success(Path.of("A.cs"), 1, 1, List.of(), null),
            ProcessingResult.failed(Path.of("B.cs"), List.of("boom"), List.of()));

        assertEquals(RemoverMain.EXIT_FAILED, RemoverMain.exitCode(results, true, out));
    }

    @Test
    void exitCodeIsReviewOnlyWithFailOnReview() {
        List<ProcessingResult> results = List.of(
            ProcessingResult.success(Path.of("A.cs"), 0, 2, List.of(), null));

        assertEquals(RemoverMain.EXIT_OK, RemoverMain.exitCode(results, false, out));
        assertEquals(RemoverMain.EXIT_REVIEW, RemoverMain.exitCode(results, true, out));
        assertTrue(output().contains("Exiting with code 2"));
    }
}
