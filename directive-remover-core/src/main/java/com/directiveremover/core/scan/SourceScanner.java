package com.directiveremover.core.scan;

import com.directiveremover.core.condition.Condition;
import com.directiveremover.core.condition.ConditionParseException;
import com.directiveremover.core.condition.ConditionParser;

import java.util.*;

/**
 * Single-pass lexer and preprocessor for C# source text.
 *
 * Locates every directive line and reports syntax errors in the active text,
 * given the set of defined symbols. Inactive branches are not lexed; only their
 * directive lines are recognized so that nesting stays correct. Directive-like
 * text inside comments, strings, verbatim/raw strings and interpolation holes
 * is never treated as a directive.
 *
 * Stateless between calls; each {@link #scan} runs a fresh {@link Pass}.
 */
public class SourceScanner {

    private static final Set<String> KNOWN_DIRECTIVES = Set.of(
        "if", "elif", "else", "endif", "define", "undef", "region", "endregion",
        "pragma", "error", "warning", "line", "nullable", "r", "load"
    );

    private final Set<String> definedSymbols;

    public SourceScanner(Collection<String> definedSymbols) {
        this.definedSymbols = Set.copyOf(definedSymbols);
    }

    public ScanResult scan(String text) {
        return new Pass(text, new HashSet<>(definedSymbols)).run();
    }

    /** One open #if ... #endif while scanning. */
    private static final class Frame {
        final Directive opener;
        final boolean parentActive;
        boolean active;
        boolean taken;
        boolean sawElse;

        Frame(Directive opener, boolean parentActive, boolean active) {
            this.opener = opener;
            this.parentActive = parentActive;
            this.active = active;
            this.taken = active;
        }
    }

    private record OpenDelimiter(char ch, int offset, int line) {}

    private static final class Pass {
        private final String text;
        private final int length;
        private final Set<String> symbols;
        private final List<Directive> directives = new ArrayList<>();
        private final List<SyntaxDiagnostic> diagnostics = new ArrayList<>();
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final Deque<OpenDelimiter> delimiters = new ArrayDeque<>();

        private int pos;
        private int line = 1;
        private int lineStart;
        // true once a token has been seen on the current top-level line
        private boolean lineHasCode;

        Pass(String text, Set<String> symbols) {
            this.text = text;
            this.length = text.length();
            this.symbols = symbols;
        }

        ScanResult run() {
            while (pos < length) {
                if (!isActive()) {
                    skipInactiveLine();
                    continue;
                }
                if (!lineHasCode) {
                    int p = skipHorizontalWhitespace(pos);
                    if (p < length && text.charAt(p) == '#') {
                        readDirective(p);
                        continue;
                    }
                    pos = p;
                    if (pos >= length) break;
                }
                char c = text.charAt(pos);
                if (c == '\n') {
                    pos++;
                    newline();
                    lineHasCode = false;
                } else if (Character.isWhitespace(c)) {
                    pos++;
                } else {
                    lineHasCode = true;
                    lexToken();
                }
            }

            for (Iterator<Frame> it = frames.descendingIterator(); it.hasNext(); ) {
                Directive opener = it.next().opener;
                error(opener.hashOffset(), opener.line(), "#endif directive expected");
            }
            for (Iterator<OpenDelimiter> it = delimiters.descendingIterator(); it.hasNext(); ) {
                OpenDelimiter open = it.next();
                error(open.offset(), open.line(), "'" + closerFor(open.ch()) + "' expected");
            }
            return new ScanResult(directives, diagnostics);
        }

        // ------------------------------------------------------------------
        // Directives and conditional state
        // ------------------------------------------------------------------

        private boolean isActive() {
            Frame top = frames.peek();
            return top == null || top.active;
        }

        private void skipInactiveLine() {
            int p = skipHorizontalWhitespace(pos);
            if (p < length && text.charAt(p) == '#') {
                readDirective(p);
                return;
            }
            while (pos < length && text.charAt(pos) != '\n') {
                pos++;
            }
            if (pos < length) {
                pos++;
                newline();
            }
        }

        private void readDirective(int hash) {
            int end = hash;
            while (end < length && text.charAt(end) != '\n') {
                end++;
            }
            int contentEnd = end;
            String terminator = "";
            int lineEnd = end;
            if (end < length) {
                lineEnd = end + 1;
                if (end > hash && text.charAt(end - 1) == '\r') {
                    contentEnd = end - 1;
                    terminator = "\r\n";
                } else {
                    terminator = "\n";
                }
            }

            String body = text.substring(hash + 1, contentEnd);
            int k = 0;
            while (k < body.length() && (body.charAt(k) == ' ' || body.charAt(k) == '\t')) k++;
            int keywordStart = k;
            while (k < body.length() && Character.isLetter(body.charAt(k))) k++;
            String keyword = body.substring(keywordStart, k);
            String rest = body.substring(k);
            DirectiveKind kind = DirectiveKind.fromKeyword(keyword);

            String argument;
            Condition condition = null;
            String parseError = null;
            if (kind == DirectiveKind.IF || kind == DirectiveKind.ELIF) {
                argument = stripLineComment(rest).trim();
                try {
                    condition = ConditionParser.parse(argument);
                } catch (ConditionParseException e) {
                    parseError = e.getMessage();
                }
            } else if (kind == DirectiveKind.OTHER) {
                argument = rest.trim();
            } else {
                argument = stripLineComment(rest).trim();
            }

            Directive directive = new Directive(kind, keyword, line, lineStart, hash, lineEnd,
                terminator, argument, condition, parseError);
            directives.add(directive);
            applyDirective(directive);

            pos = lineEnd;
            if (!terminator.isEmpty()) {
                newline();
            }
            lineHasCode = false;
        }

        private void applyDirective(Directive d) {
            Frame top = frames.peek();
            switch (d.kind()) {
                case IF -> {
                    boolean parentActive = isActive();
                    if (parentActive) reportConditionError(d);
                    frames.push(new Frame(d, parentActive, parentActive && evaluate(d)));
                }
                case ELIF -> {
                    if (top == null) {
                        error(d.hashOffset(), d.line(), "Unexpected preprocessor directive");
                    } else if (top.sawElse) {
                        error(d.hashOffset(), d.line(), "#elif after #else");
                    } else {
                        if (top.parentActive) reportConditionError(d);
                        boolean value = top.parentActive && !top.taken && evaluate(d);
                        top.active = value;
                        top.taken |= value;
                    }
                }
                case ELSE -> {
                    if (top == null) {
                        error(d.hashOffset(), d.line(), "Unexpected preprocessor directive");
                    } else if (top.sawElse) {
                        error(d.hashOffset(), d.line(), "#else after #else");
                    } else {
                        top.active = top.parentActive && !top.taken;
                        top.taken = true;
                        top.sawElse = true;
                    }
                    expectEndOfDirective(d);
                }
                case ENDIF -> {
                    if (top == null) {
                        error(d.hashOffset(), d.line(), "Unexpected preprocessor directive");
                    } else {
                        frames.pop();
                    }
                    expectEndOfDirective(d);
                }
                case OTHER -> {
                    if (isActive()) applyOtherDirective(d);
                }
            }
        }

        private void applyOtherDirective(Directive d) {
            switch (d.keyword()) {
                case "define" -> symbols.add(firstWord(d.argument()));
                case "undef" -> symbols.remove(firstWord(d.argument()));
                case "error" -> error(d.hashOffset(), d.line(), "#error: '" + d.argument() + "'");
                default -> {
                    if (!KNOWN_DIRECTIVES.contains(d.keyword())) {
                        error(d.hashOffset(), d.line(), "Preprocessor directive expected");
                    }
                }
            }
        }

        private boolean evaluate(Directive d) {
            return d.condition() != null && d.condition().evaluate(symbols);
        }

        private void reportConditionError(Directive d) {
            if (d.parseError() != null) {
                error(d.hashOffset(), d.line(), "Invalid preprocessor expression: " + d.parseError());
            }
        }

        private void expectEndOfDirective(Directive d) {
            if (!d.argument().isEmpty() && isActive()) {
                error(d.hashOffset(), d.line(), "Single-line comment or end-of-line expected");
            }
        }

        // ------------------------------------------------------------------
        // Tokens in active code
        // ------------------------------------------------------------------

        private void lexToken() {
            char c = text.charAt(pos);
            char next = charAt(pos + 1);
            switch (c) {
                case '/' -> {
                    if (next == '/') skipLineComment();
                    else if (next == '*') lexBlockComment();
                    else pos++;
                }
                case '"' -> {
                    if (text.startsWith("\"\"\"", pos)) lexRawString(0);
                    else lexRegularString(false);
                }
                case '@' -> {
                    if (next == '"') {
                        pos++;
                        lexVerbatimString(false);
                    } else if (next == '$' && charAt(pos + 2) == '"') {
                        pos += 2;
                        lexVerbatimString(true);
                    } else {
                        pos++;
                    }
                }
                case '$' -> lexDollar();
                case '\'' -> lexCharLiteral();
                case '(', '[', '{' -> {
                    delimiters.push(new OpenDelimiter(c, pos, line));
                    pos++;
                }
                case ')', ']', '}' -> {
                    closeDelimiter(c);
                    pos++;
                }
                case '#' -> {
                    error(pos, line,
                        "Preprocessor directives must appear as the first non-whitespace character on a line");
                    pos++;
                }
                case '\n' -> {
                    pos++;
                    newline();
                }
                default -> pos++;
            }
        }

        private void lexDollar() {
            int dollars = 0;
            while (charAt(pos + dollars) == '$') dollars++;
            int q = pos + dollars;
            if (charAt(q) == '@' && charAt(q + 1) == '"') {
                pos = q + 1;
                lexVerbatimString(true);
            } else if (charAt(q) == '"') {
                pos = q;
                if (text.startsWith("\"\"\"", q)) lexRawString(dollars);
                else lexRegularString(true);
            } else {
                pos = q;
            }
        }

        private void closeDelimiter(char closer) {
            OpenDelimiter top = delimiters.peek();
            if (top != null && closerFor(top.ch()) == closer) {
                delimiters.pop();
            } else {
                error(pos, line, "Unexpected '" + closer + "'");
            }
        }

        private void skipLineComment() {
            while (pos < length && text.charAt(pos) != '\n') {
                pos++;
            }
        }

        private void lexBlockComment() {
            int startLine = line;
            int start = pos;
            pos += 2;
            while (pos < length) {
                char c = text.charAt(pos);
                if (c == '*' && charAt(pos + 1) == '/') {
                    pos += 2;
                    return;
                }
                pos++;
                if (c == '\n') newline();
            }
            error(start, startLine, "End-of-file found, '*/' expected");
        }

        /** {@code "..."} or {@code $"..."}; pos is on the opening quote. */
        private void lexRegularString(boolean interpolated) {
            int start = pos;
            int startLine = line;
            pos++;
            while (pos < length) {
                char c = text.charAt(pos);
                if (c == '"') {
                    pos++;
                    return;
                }
                if (c == '\n' || (c == '\r' && charAt(pos + 1) == '\n')) {
                    error(start, startLine, "Newline in constant");
                    return;
                }
                if (c == '\\') {
                    pos += charAt(pos + 1) == '\n' ? 1 : 2;
                } else if (interpolated && c == '{') {
                    if (charAt(pos + 1) == '{') {
                        pos += 2;
                    } else {
                        pos++;
                        lexInterpolationHole();
                    }
                } else {
                    pos++;
                }
            }
            error(start, startLine, "Newline in constant");
        }

        /** {@code @"..."} or {@code $@"..."}; pos is on the opening quote. */
        private void lexVerbatimString(boolean interpolated) {
            int start = pos;
            int startLine = line;
            pos++;
            while (pos < length) {
                char c = text.charAt(pos);
                if (c == '"') {
                    if (charAt(pos + 1) == '"') {
                        pos += 2;
                        continue;
                    }
                    pos++;
                    return;
                }
                if (interpolated && c == '{') {
                    if (charAt(pos + 1) == '{') {
                        pos += 2;
                    } else {
                        pos++;
                        lexInterpolationHole();
                    }
                    continue;
                }
                pos++;
                if (c == '\n') newline();
            }
            error(start, startLine, "Unterminated string literal");
        }

        /**
         * {@code """..."""} with three or more quotes; {@code dollars} is the
         * number of leading '$' (0 when not interpolated) and the brace run
         * length that opens a hole.
         */
        private void lexRawString(int dollars) {
            int start = pos;
            int startLine = line;
            int quotes = 0;
            while (charAt(pos + quotes) == '"') quotes++;
            pos += quotes;
            while (pos < length) {
                char c = text.charAt(pos);
                if (c == '"') {
                    int run = 0;
                    while (charAt(pos + run) == '"') run++;
                    pos += run;
                    if (run >= quotes) return;
                    continue;
                }
                if (dollars > 0 && c == '{') {
                    int run = 0;
                    while (charAt(pos + run) == '{') run++;
                    pos += run;
                    if (run >= dollars) lexInterpolationHole();
                    continue;
                }
                pos++;
                if (c == '\n') newline();
            }
            error(start, startLine, "Unterminated raw string literal");
        }

        /**
         * Lexes expression code up to the '}' that closes the hole. A ':' at the
         * hole's top level starts a format specifier, which runs to that '}'.
         */
        private void lexInterpolationHole() {
            int base = delimiters.size();
            int braces = 0;
            while (pos < length) {
                char c = text.charAt(pos);
                if (c == '}' && braces == 0 && delimiters.size() == base) {
                    pos++;
                    return;
                }
                if (c == ':' && braces == 0 && delimiters.size() == base
                        && charAt(pos + 1) != ':' && charAt(pos - 1) != ':') {
                    while (pos < length && text.charAt(pos) != '}' && text.charAt(pos) != '\n') pos++;
                    continue;
                }
                if (c == '{') {
                    braces++;
                    pos++;
                } else if (c == '}' && braces > 0) {
                    braces--;
                    pos++;
                } else if (c == '}') {
                    // unclosed ( or [ inside the hole
                    while (delimiters.size() > base) {
                        OpenDelimiter open = delimiters.pop();
                        error(open.offset(), open.line(), "'" + closerFor(open.ch()) + "' expected");
                    }
                } else {
                    lexToken();
                }
            }
        }

        private void lexCharLiteral() {
            int start = pos;
            pos++;
            if (charAt(pos) == '\'') {
                error(start, line, "Empty character literal");
                pos++;
                return;
            }
            if (charAt(pos) == '\\') pos++;
            if (pos < length && text.charAt(pos) != '\n') pos++;
            while (pos < length && text.charAt(pos) != '\'' && text.charAt(pos) != '\n') {
                pos++;
            }
            if (pos < length && text.charAt(pos) == '\'') {
                pos++;
            } else {
                error(start, line, "Newline in constant");
            }
        }

        // ------------------------------------------------------------------
        // Helpers
        // ------------------------------------------------------------------

        private void newline() {
            line++;
            lineStart = pos;
        }

        private char charAt(int index) {
            return index >= 0 && index < length ? text.charAt(index) : '\0';
        }

        private int skipHorizontalWhitespace(int from) {
            int p = from;
            while (p < length) {
                char c = text.charAt(p);
                if (c == '\n' || !Character.isWhitespace(c)) break;
                p++;
            }
            return p;
        }

        private void error(int offset, int atLine, String message) {
            diagnostics.add(new SyntaxDiagnostic(offset, atLine, message));
        }

        private static char closerFor(char open) {
            return switch (open) {
                case '(' -> ')';
                case '[' -> ']';
                default -> '}';
            };
        }

        private static String stripLineComment(String s) {
            int idx = s.indexOf("//");
            return idx >= 0 ? s.substring(0, idx) : s;
        }

        private static String firstWord(String s) {
            String trimmed = stripLineComment(s).trim();
            int space = 0;
            while (space < trimmed.length() && !Character.isWhitespace(trimmed.charAt(space))) space++;
            return trimmed.substring(0, space);
        }
    }
}
