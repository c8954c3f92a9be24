package com.directiveremover.cli.processing;

import com.directiveremover.cli.config.RemoverConfig;

import java.nio.file.Path;
import java.util.List;

/**
 * Settings for one run, resolved from remover.json and the command line.
 *
 * @param reportPath          where to write the JSON report, or null for none
 * @param additionalDefines   symbols defined while parsing, besides the target and its alias
 * @param excludedDirectories directory names skipped while walking a source tree
 */
public record ProcessingOptions(
    boolean dryRun,
    boolean verbose,
    boolean includeGenerated,
    boolean backup,
    boolean parallel,
    Path reportPath,
    boolean failOnReview,
    String targetSymbol,
    List<String> additionalDefines,
    List<String> excludedDirectories
) {

    public static final String DEFAULT_TARGET = "NET8_0_OR_GREATER";
    public static final List<String> DEFAULT_EXCLUDED_DIRECTORIES = List.of("obj", "bin", ".git");

    public ProcessingOptions {
        additionalDefines = List.copyOf(additionalDefines);
        excludedDirectories = List.copyOf(excludedDirectories);
    }

    public static ProcessingOptions defaults() {
        return new ProcessingOptions(false, false, false, false, false, null, false,
            DEFAULT_TARGET, List.of(), DEFAULT_EXCLUDED_DIRECTORIES);
    }

    /** Defaults overridden by whatever the config file sets. */
    public static ProcessingOptions fromConfig(RemoverConfig config) {
        return new ProcessingOptions(
            false,
            false,
            Boolean.TRUE.equals(config.getIncludeGenerated()),
            Boolean.TRUE.equals(config.getBackup()),
            Boolean.TRUE.equals(config.getParallel()),
            config.getReport() != null ? Path.of(config.getReport()) : null,
            Boolean.TRUE.equals(config.getFailOnReview()),
            config.getTargetSymbol() != null ? config.getTargetSymbol() : DEFAULT_TARGET,
            config.getDefines(),
            config.getExcludedDirectories() != null
                ? config.getExcludedDirectories()
                : DEFAULT_EXCLUDED_DIRECTORIES
        );
    }
}
