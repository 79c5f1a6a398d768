package com.luanvv.clearance.extract;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a price out of locale-formatted text such as {@code "19,99 $"} or {@code "$1299.00"}.
 * Currency symbols and labels are ignored; thousands separators are not supported.
 */
public final class PriceParser {
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u202F]+");
    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:[.,]\\d+)?)");

    private PriceParser() {
    }

    public static OptionalDouble parse(String text) {
        if (text == null || text.isEmpty()) {
            return OptionalDouble.empty();
        }
        Matcher m = NUMBER.matcher(WHITESPACE.matcher(text).replaceAll(""));
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        try {
            double value = Double.parseDouble(m.group(1).replace(',', '.'));
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /** Same as {@link #parse(String)} with {@code null} standing for absent. */
    public static Double parseOrNull(String text) {
        OptionalDouble parsed = parse(text);
        return parsed.isPresent() ? parsed.getAsDouble() : null;
    }
}
