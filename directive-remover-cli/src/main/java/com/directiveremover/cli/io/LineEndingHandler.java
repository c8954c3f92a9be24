package com.directiveremover.cli.io;

public final class LineEndingHandler {

    private LineEndingHandler() {}

    /** The dominant line ending; LF on a tie or when there are no line breaks. */
    public static LineEnding detect(String content) {
        int crlf = 0;
        int lf = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') {
                crlf++;
                i++;
            } else if (c == '\n') {
                lf++;
            }
        }
        return crlf > lf ? LineEnding.CRLF : LineEnding.LF;
    }

    public static String normalize(String content, LineEnding target) {
        String unified = content.replace("\r\n", "\n");
        return target == LineEnding.CRLF ? unified.replace("\n", "\r\n") : unified;
    }
}
