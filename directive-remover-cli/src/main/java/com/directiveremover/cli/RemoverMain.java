package com.directiveremover.cli;

import com.directiveremover.cli.config.ConfigReader;
import com.directiveremover.cli.config.RemoverConfig;
import com.directiveremover.cli.io.SourceFileCollector;
import com.directiveremover.cli.processing.BatchRunner;
import com.directiveremover.cli.processing.FileProcessor;
import com.directiveremover.cli.processing.ProcessingOptions;
import com.directiveremover.cli.processing.ProcessingResult;
import com.directiveremover.cli.processing.ResultStatus;
import com.directiveremover.cli.report.ReportModel;
import com.directiveremover.cli.report.ReportWriter;
import com.directiveremover.cli.report.ResultPrinter;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the directive remover.
 *
 * Usage:
 *   java -jar directive-remover-cli.jar <path> \
 *     [--dry-run] [--verbose] [--include-generated] [--backup] [--parallel] \
 *     [--report <file>] [--target <symbol>] [--define <symbol>]... \
 *     [--fail-on-review] [--config <remover.json>]
 */
public class RemoverMain {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_REVIEW = 2;
    static final int EXIT_USAGE = 64;

    public static void main(String[] args) {
        System.exit(execute(args, System.out));
    }

    /** Runs and maps every outcome to an exit code; never throws. */
    static int execute(String[] args, PrintStream out) {
        try {
            return run(args, out);
        } catch (UsageException e) {
            System.err.println("[directive-remover] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar directive-remover-cli.jar <path> [--dry-run] [--verbose] "
                    + "[--include-generated] [--backup] [--parallel] [--report <file>] [--target <symbol>] "
                    + "[--define <symbol>] [--fail-on-review] [--config <file>]");
            return EXIT_USAGE;
        } catch (Exception e) {
            System.err.println("[directive-remover] FATAL: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No path specified");
        }

        // Parse flags
        String path = null;
        String configPath = null;
        Boolean dryRun = null;
        Boolean verbose = null;
        Boolean includeGenerated = null;
        Boolean backup = null;
        Boolean parallel = null;
        Boolean failOnReview = null;
        String reportPath = null;
        String target = null;
        List<String> defines = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dry-run"           -> dryRun = true;
                case "--verbose"           -> verbose = true;
                case "--include-generated" -> includeGenerated = true;
                case "--backup"            -> backup = true;
                case "--parallel"          -> parallel = true;
                case "--fail-on-review"    -> failOnReview = true;
                case "--report"            -> reportPath = requireNext(args, i++, "--report");
                case "--target"            -> target     = requireNext(args, i++, "--target");
                case "--define"            -> defines.add(requireNext(args, i++, "--define"));
                case "--config"            -> configPath = requireNext(args, i++, "--config");
                default -> {
                    if (args[i].startsWith("--")) {
                        throw new UsageException("Unknown flag: " + args[i]);
                    }
                    if (path != null) {
                        throw new UsageException("Only one path may be given, got: " + path + " and " + args[i]);
                    }
                    path = args[i];
                }
            }
        }

        if (path == null) throw new UsageException("<path> is required");
        if (target != null && target.isBlank()) throw new UsageException("--target must not be blank");

        // 1. Resolve options: defaults < remover.json < flags
        ProcessingOptions base = ProcessingOptions.defaults();
        if (configPath != null) {
            System.err.println("[directive-remover] Reading config: " + configPath);
            RemoverConfig config = new ConfigReader().read(Paths.get(configPath));
            base = ProcessingOptions.fromConfig(config);
        }
        List<String> allDefines = new ArrayList<>(base.additionalDefines());
        allDefines.addAll(defines);
        ProcessingOptions options = new ProcessingOptions(
                orDefault(dryRun, base.dryRun()),
                orDefault(verbose, base.verbose()),
                orDefault(includeGenerated, base.includeGenerated()),
                orDefault(backup, base.backup()),
                orDefault(parallel, base.parallel()),
                reportPath != null ? Paths.get(reportPath) : base.reportPath(),
                orDefault(failOnReview, base.failOnReview()),
                target != null ? target : base.targetSymbol(),
                allDefines,
                base.excludedDirectories()
        );

        // 2. Discover files
        Path root = Paths.get(path);
        List<Path> files = new SourceFileCollector(options.excludedDirectories(), options.includeGenerated())
                .collect(root);
        if (options.verbose()) {
            System.err.println("[directive-remover] Target symbol: " + options.targetSymbol()
                    + (options.additionalDefines().isEmpty() ? "" : ", defines: " + options.additionalDefines()));
        }

        // 3. Process
        ResultPrinter printer = new ResultPrinter(out, options.verbose());
        printer.printHeader(files.size(), options.dryRun(), options.backup());

        FileProcessor processor = new FileProcessor(options);
        BatchRunner runner = new BatchRunner(processor, options.parallel(), result -> {
            printer.printResult(result);
            if (options.dryRun() && options.verbose()) {
                printer.printPreview(result);
            }
        });
        List<ProcessingResult> results = runner.run(files);

        printer.printSummary(results);

        // 4. Report
        if (options.reportPath() != null) {
            ReportModel.Report report = ReportModel.from(results, options.targetSymbol(), Instant.now());
            new ReportWriter().write(report, options.reportPath());
            out.println();
            out.println("Report written to: " + options.reportPath());
        }

        return exitCode(results, options.failOnReview(), out);
    }

    static int exitCode(List<ProcessingResult> results, boolean failOnReview, PrintStream out) {
        if (results.stream().anyMatch(r -> r.status() == ResultStatus.FAILED)) {
            return EXIT_FAILED;
        }
        boolean flagged = results.stream().anyMatch(r -> r.blocksFlagged() > 0);
        if (failOnReview && flagged) {
            out.println();
            out.println("Error: --fail-on-review: Exiting with code 2 (manual review required)");
            return EXIT_REVIEW;
        }
        return EXIT_OK;
    }

    private static boolean orDefault(Boolean flag, boolean fallback) {
        return flag != null ? flag : fallback;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
