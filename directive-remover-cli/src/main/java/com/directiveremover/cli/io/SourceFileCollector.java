package com.directiveremover.cli.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves the command-line path to the list of C# files to process.
 */
public class SourceFileCollector {

    private final Set<String> excludedDirectories;
    private final boolean includeGenerated;

    public SourceFileCollector(List<String> excludedDirectories, boolean includeGenerated) {
        this.excludedDirectories = Set.copyOf(excludedDirectories);
        this.includeGenerated = includeGenerated;
    }

    /**
     * A regular file is returned as-is. A directory is walked for {@code *.cs} files,
     * skipping excluded directories and, unless generated files are included, files
     * whose name marks them as generated. The result is sorted.
     *
     * @throws SourceCollectionException if the path does not exist or cannot be walked
     */
    public List<Path> collect(Path root) {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        if (!Files.isDirectory(root)) {
            throw new SourceCollectionException("Path not found: " + root);
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".cs"))
                .filter(p -> !isUnderExcludedDirectory(root, p))
                .filter(p -> includeGenerated || !GeneratedFileDetector.hasGeneratedName(p))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new SourceCollectionException("Failed to scan " + root + ": " + e.getMessage(), e);
        }
    }

    private boolean isUnderExcludedDirectory(Path root, Path file) {
        Path relative = root.relativize(file.getParent());
        for (Path part : relative) {
            if (excludedDirectories.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }

    public static class SourceCollectionException extends RuntimeException {
        public SourceCollectionException(String message) { super(message); }
        public SourceCollectionException(String message, Throwable cause) { super(message, cause); }
    }
}
