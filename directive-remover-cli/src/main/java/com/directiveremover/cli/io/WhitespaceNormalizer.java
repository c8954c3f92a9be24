package com.directiveremover.cli.io;

import java.util.regex.Pattern;

/**
 * Tidies text after directive lines were removed: runs of three or more line breaks
 * become a single blank line, trailing whitespace is trimmed from every line, and all
 * line breaks use one style.
 */
public final class WhitespaceNormalizer {

    private static final Pattern EXCESS_NEWLINES = Pattern.compile("(\\r?\\n){3,}");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private WhitespaceNormalizer() {}

    public static String normalize(String content, LineEnding lineEnding) {
        String newline = lineEnding.separator();
        String collapsed = EXCESS_NEWLINES.matcher(content).replaceAll(newline + newline);

        String[] lines = LINE_BREAK.split(collapsed, -1);
        StringBuilder out = new StringBuilder(collapsed.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) out.append(newline);
            out.append(lines[i].stripTrailing());
        }
        return out.toString();
    }
}
