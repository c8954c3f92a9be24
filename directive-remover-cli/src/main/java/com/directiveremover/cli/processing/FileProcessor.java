package com.directiveremover.cli.processing;

import com.directiveremover.cli.io.BomHandler;
import com.directiveremover.cli.io.FileBackup;
import com.directiveremover.cli.io.GeneratedFileDetector;
import com.directiveremover.cli.io.LineEnding;
import com.directiveremover.cli.io.LineEndingHandler;
import com.directiveremover.cli.io.WhitespaceNormalizer;
import com.directiveremover.core.ConditionalRemover;
import com.directiveremover.core.RemovalResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one file through the remover: backup, read, rewrite, normalize, write, verify.
 *
 * Every failure is turned into a {@link ResultStatus#FAILED} result and the backup,
 * if one was taken, is restored. Safe to share between worker threads: each call
 * touches only its own file.
 */
public class FileProcessor {

    private final ProcessingOptions options;
    private final ConditionalRemover remover;

    public FileProcessor(ProcessingOptions options) {
        this.options = options;
        this.remover = new ConditionalRemover(options.targetSymbol(), options.additionalDefines());
    }

    public ProcessingResult process(Path file) {
        Path backup = null;
        try {
            if (options.backup() && !options.dryRun()) {
                backup = FileBackup.create(file);
            }

            BomHandler.DecodedText decoded = BomHandler.read(file);
            String content = decoded.content();

            if (!options.includeGenerated() && GeneratedFileDetector.isGenerated(file, content)) {
                discardBackup(backup);
                return ProcessingResult.skipped(file, "Generated file");
            }

            LineEnding lineEnding = LineEndingHandler.detect(content);
            RemovalResult removal = remover.process(content);
            if (removal.failed()) {
                List<String> errors = new ArrayList<>(removal.errors());
                restoreBackup(backup, file, errors);
                return ProcessingResult.failed(file, errors, removal.issues());
            }

            String output = removal.changed()
                ? WhitespaceNormalizer.normalize(removal.text(), lineEnding)
                : content;

            if (!options.dryRun() && !output.equals(content)) {
                BomHandler.write(file, output, decoded.hasBom());
                BomHandler.DecodedText written = BomHandler.read(file);
                if (!written.content().equals(output)) {
                    throw new IOException("Write verification failed for " + file + ": content mismatch after write");
                }
            }
            discardBackup(backup);

            String preview = null;
            if (options.dryRun()) {
                preview = decoded.hasBom() ? "\uFEFF" + output : output;
            }
            return ProcessingResult.success(file, removal.blocksRemoved(), removal.blocksFlagged(),
                removal.issues(), preview);
        } catch (Exception e) {
            List<String> errors = new ArrayList<>();
            errors.add("Unexpected error: " + e.getMessage());
            restoreBackup(backup, file, errors);
            return ProcessingResult.failed(file, errors, List.of());
        }
    }

    private static void restoreBackup(Path backup, Path file, List<String> errors) {
        if (backup == null) return;
        try {
            FileBackup.restore(backup, file);
        } catch (IOException e) {
            System.err.println("[directive-remover] WARNING: could not restore " + file + " from " + backup
                + ": " + e.getMessage());
            errors.add("Backup restore failed, original kept at " + backup);
        }
    }

    private static void discardBackup(Path backup) throws IOException {
        if (backup != null) {
            FileBackup.cleanup(backup);
        }
    }
}
