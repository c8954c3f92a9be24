package com.directiveremover.cli.report;

import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Serializes the run report to JSON, with files sorted by path for deterministic output.
 */
public class ReportWriter {

    public static class ReportException extends RuntimeException {
        public ReportException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * @param report     report to write
     * @param reportPath target file; parent directories are created if absent
     */
    public void write(ReportModel.Report report, Path reportPath) {
        Path parent = reportPath.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new ReportException("Could not create report directory: " + parent, e);
        }

        if (report.files != null) {
            report.files = new ArrayList<>(report.files);
            report.files.sort(Comparator.comparing(f -> f.path));
        }

        var gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        try (Writer w = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
            gson.toJson(report, w);
        } catch (IOException e) {
            throw new ReportException("Failed to write report: " + e.getMessage(), e);
        }
        System.err.println("[directive-remover] Report written: " + reportPath);
    }
}
