package com.directiveremover.core.rewrite;

import com.directiveremover.core.scan.TextSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * An immutable set of deletions and insertions against one original text.
 *
 * Edits are applied in a single copy pass: text is copied from the original except
 * where it falls inside a deletion, and each insertion is emitted at its offset.
 * Overlapping or touching deletions are merged. An insertion that falls strictly
 * inside a deletion is emitted where the deletion starts.
 */
public final class SourceEdits {

    /** Text inserted before the character at {@code offset}. */
    public record Insertion(int offset, String text) {}

    private static final SourceEdits EMPTY = new SourceEdits(List.of(), List.of());

    private final List<TextSpan> deletions;
    private final List<Insertion> insertions;

    private SourceEdits(List<TextSpan> deletions, List<Insertion> insertions) {
        this.deletions = mergeSpans(deletions);
        List<Insertion> sorted = new ArrayList<>(insertions);
        sorted.sort(Comparator.comparingInt(Insertion::offset));
        this.insertions = Collections.unmodifiableList(sorted);
    }

    public static SourceEdits empty() {
        return EMPTY;
    }

    public static SourceEdits deleting(List<TextSpan> spans) {
        return new SourceEdits(spans, List.of());
    }

    public static SourceEdits inserting(List<Insertion> insertions) {
        return new SourceEdits(List.of(), insertions);
    }

    /** Edits of both; insertions at the same offset keep this-then-other order. */
    public SourceEdits merge(SourceEdits other) {
        List<TextSpan> allDeletions = new ArrayList<>(deletions);
        allDeletions.addAll(other.deletions);
        List<Insertion> allInsertions = new ArrayList<>(insertions);
        allInsertions.addAll(other.insertions);
        return new SourceEdits(allDeletions, allInsertions);
    }

    public List<TextSpan> deletions() {
        return deletions;
    }

    public List<Insertion> insertions() {
        return insertions;
    }

    public boolean isEmpty() {
        return deletions.isEmpty() && insertions.isEmpty();
    }

    /**
     * Applies the edits to {@code original}, which must be the text the spans were computed on.
     * When the original does not end with a line terminator, neither does the result.
     */
    public String apply(String original) {
        if (isEmpty()) {
            return original;
        }
        for (TextSpan span : deletions) {
            if (span.end() > original.length()) {
                throw new IllegalArgumentException("Deletion " + span + " is outside the text of length "
                    + original.length());
            }
        }

        StringBuilder out = new StringBuilder(original.length());
        int pos = 0;
        int next = 0;
        for (TextSpan deletion : deletions) {
            while (next < insertions.size() && insertions.get(next).offset() <= deletion.start()) {
                Insertion ins = insertions.get(next++);
                out.append(original, pos, ins.offset()).append(ins.text());
                pos = ins.offset();
            }
            out.append(original, pos, deletion.start());
            while (next < insertions.size() && insertions.get(next).offset() < deletion.end()) {
                out.append(insertions.get(next++).text());
            }
            pos = deletion.end();
        }
        while (next < insertions.size()) {
            Insertion ins = insertions.get(next++);
            int at = Math.max(pos, ins.offset());
            out.append(original, pos, at).append(ins.text());
            pos = at;
        }
        out.append(original, pos, original.length());

        if (!original.isEmpty() && !original.endsWith("\n")) {
            stripOneTerminator(out);
        }
        return out.toString();
    }

    private static void stripOneTerminator(StringBuilder out) {
        int len = out.length();
        if (len > 0 && out.charAt(len - 1) == '\n') {
            int cut = len >= 2 && out.charAt(len - 2) == '\r' ? 2 : 1;
            out.setLength(len - cut);
        }
    }

    static List<TextSpan> mergeSpans(List<TextSpan> spans) {
        List<TextSpan> sorted = new ArrayList<>(spans);
        sorted.removeIf(TextSpan::isEmpty);
        Collections.sort(sorted);
        List<TextSpan> merged = new ArrayList<>();
        for (TextSpan span : sorted) {
            if (!merged.isEmpty()) {
                TextSpan last = merged.get(merged.size() - 1);
                if (span.start() <= last.end()) {
                    merged.set(merged.size() - 1, new TextSpan(last.start(), Math.max(last.end(), span.end())));
                    continue;
                }
            }
            merged.add(span);
        }
        return Collections.unmodifiableList(merged);
    }

    @Override
    public String toString() {
        return "SourceEdits[deletions=" + deletions + ", insertions=" + insertions.size() + "]";
    }
}
