package com.directiveremover.core.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Name variants of a target symbol.
 *
 * {@code NET8_0_OR_GREATER} and {@code NET_8_0_OR_GREATER} are treated as the same
 * symbol: an underscore between the leading letters and the first digit is
 * optional.
 */
public final class TargetSymbols {

    private static final Pattern LETTERS_THEN_DIGIT = Pattern.compile("([A-Za-z]+)(_?)([0-9].*)");

    private TargetSymbols() {}

    /** The symbol first, then its alias when it has one. */
    public static List<String> of(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Target symbol must not be blank");
        }
        String trimmed = symbol.trim();
        Set<String> aliases = new LinkedHashSet<>();
        aliases.add(trimmed);
        Matcher m = LETTERS_THEN_DIGIT.matcher(trimmed);
        if (m.matches()) {
            String separator = m.group(2).isEmpty() ? "_" : "";
            aliases.add(m.group(1) + separator + m.group(3));
        }
        return new ArrayList<>(aliases);
    }
}
