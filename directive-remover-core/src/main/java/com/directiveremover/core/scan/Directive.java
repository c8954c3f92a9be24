package com.directiveremover.core.scan;

import com.directiveremover.core.condition.Condition;

/**
 * One preprocessor directive line as located in the source.
 *
 * @param kind          directive kind
 * @param keyword       keyword after '#', e.g. "if", "region"
 * @param line          1-based line number
 * @param lineStart     offset of the first character of the line (indentation included)
 * @param hashOffset    offset of the '#'
 * @param lineEnd       offset just past the line terminator (text length on the last line)
 * @param terminator    "\n", "\r\n", or "" on an unterminated last line
 * @param argument      text after the keyword; for if/elif the condition without trailing comment
 * @param condition     parsed condition for if/elif, null otherwise or when it did not parse
 * @param parseError    parse failure message for if/elif, null otherwise
 */
public record Directive(
    DirectiveKind kind,
    String keyword,
    int line,
    int lineStart,
    int hashOffset,
    int lineEnd,
    String terminator,
    String argument,
    Condition condition,
    String parseError
) {

    /** The whole line including its terminator. */
    public TextSpan lineSpan() {
        return new TextSpan(lineStart, lineEnd);
    }

    public boolean hasCondition() {
        return condition != null;
    }

    /** Whitespace preceding the '#' on its line, taken from {@code text}. */
    public String indent(String text) {
        return text.substring(lineStart, hashOffset);
    }

    @Override
    public String toString() {
        String suffix = argument == null || argument.isEmpty() ? "" : " " + argument;
        return "#" + keyword + suffix + " (line " + line + ")";
    }
}
