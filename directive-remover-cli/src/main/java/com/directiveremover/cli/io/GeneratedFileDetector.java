package com.directiveremover.cli.io;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Recognizes tool-generated C# sources, by file name and by the auto-generated header.
 */
public final class GeneratedFileDetector {

    private static final List<String> GENERATED_SUFFIXES = List.of(
        ".g.cs", ".g.i.cs", ".designer.cs", ".generated.cs", ".assemblyinfo.cs", ".assemblyattributes.cs"
    );

    private static final int HEADER_LINES = 20;

    private GeneratedFileDetector() {}

    /**
     * @param content file text, or null to decide by name only
     */
    public static boolean isGenerated(Path path, String content) {
        return hasGeneratedName(path) || (content != null && hasGeneratedHeader(content));
    }

    public static boolean hasGeneratedName(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) return false;
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return GENERATED_SUFFIXES.stream().anyMatch(name::endsWith);
    }

    public static boolean hasGeneratedHeader(String content) {
        String[] lines = content.split("\n", HEADER_LINES + 1);
        int limit = Math.min(lines.length, HEADER_LINES);
        for (int i = 0; i < limit; i++) {
            String line = lines[i];
            if (line.contains("<auto-generated") || line.contains("<autogenerated")) {
                return true;
            }
        }
        return false;
    }
}
