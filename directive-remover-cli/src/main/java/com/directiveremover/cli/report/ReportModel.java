package com.directiveremover.cli.report;

import com.directiveremover.cli.processing.ProcessingResult;
import com.directiveremover.cli.processing.ResultStatus;
import com.directiveremover.core.analysis.AnalysisIssue;
import com.google.gson.annotations.SerializedName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * POJOs of the JSON run report.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class ReportModel {

    private ReportModel() {}

    public static class Report {
        @SerializedName("timestamp")      public String timestamp;
        @SerializedName("target_symbol")  public String targetSymbol;
        @SerializedName("total_files")    public int totalFiles;
        @SerializedName("blocks_cleaned") public int blocksCleaned;
        @SerializedName("blocks_flagged") public int blocksFlagged;
        @SerializedName("files_failed")   public int filesFailed;
        @SerializedName("files")          public List<FileEntry> files;
    }

    public static class FileEntry {
        @SerializedName("path")           public String path;
        @SerializedName("status")         public String status;
        @SerializedName("blocks_removed") public int blocksRemoved;
        @SerializedName("blocks_flagged") public int blocksFlagged;
        @SerializedName("issues")         public List<IssueEntry> issues;
        @SerializedName("errors")         public List<String> errors;
    }

    public static class IssueEntry {
        @SerializedName("line")    public int line;
        @SerializedName("message") public String message;
    }

    public static Report from(List<ProcessingResult> results, String targetSymbol, Instant timestamp) {
        Report report = new Report();
        report.timestamp = timestamp.toString();
        report.targetSymbol = targetSymbol;
        report.totalFiles = results.size();
        report.files = new ArrayList<>();
        for (ProcessingResult result : results) {
            report.blocksCleaned += result.blocksRemoved();
            report.blocksFlagged += result.blocksFlagged();
            if (result.status() == ResultStatus.FAILED) {
                report.filesFailed++;
            }
            report.files.add(entry(result));
        }
        return report;
    }

    private static FileEntry entry(ProcessingResult result) {
        FileEntry entry = new FileEntry();
        entry.path = result.path().toString();
        entry.status = result.status().name();
        entry.blocksRemoved = result.blocksRemoved();
        entry.blocksFlagged = result.blocksFlagged();
        entry.issues = new ArrayList<>();
        for (AnalysisIssue issue : result.issues()) {
            IssueEntry ie = new IssueEntry();
            ie.line = issue.line();
            ie.message = issue.message();
            entry.issues.add(ie);
        }
        entry.errors = new ArrayList<>(result.errors());
        return entry;
    }
}
