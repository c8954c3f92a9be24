package com.directiveremover.cli.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Byte-for-byte copies of a source file taken before it is rewritten.
 */
public final class FileBackup {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private FileBackup() {}

    /**
     * Copies {@code file} to {@code <file>.bak}, or to {@code <file>.<timestamp>.bak}
     * when that name is taken.
     *
     * @return the backup path
     */
    public static Path create(Path file) throws IOException {
        Path backup = file.resolveSibling(file.getFileName() + ".bak");
        if (Files.exists(backup)) {
            String timestamp = LocalDateTime.now().format(TIMESTAMP);
            backup = file.resolveSibling(file.getFileName() + "." + timestamp + ".bak");
        }
        Files.copy(file, backup, StandardCopyOption.COPY_ATTRIBUTES);
        return backup;
    }

    public static void restore(Path backup, Path original) throws IOException {
        if (Files.exists(backup)) {
            Files.copy(backup, original, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public static void cleanup(Path backup) throws IOException {
        Files.deleteIfExists(backup);
    }
}
