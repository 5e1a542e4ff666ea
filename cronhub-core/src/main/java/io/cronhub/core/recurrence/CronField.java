package io.cronhub.core.recurrence;

import java.util.BitSet;
import java.util.List;
import java.util.Locale;

/**
 * One position of a five-field cron expression and the grammar it accepts:
 * {@code *}, {@code n}, {@code a-b}, any of those followed by {@code /step}, and comma lists.
 */
enum CronField {
    MINUTE("minute", 0, 59, List.of()),
    HOUR("hour", 0, 23, List.of()),
    DAY_OF_MONTH("day-of-month", 1, 31, List.of()),
    MONTH("month", 1, 12, List.of("jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec")),
    DAY_OF_WEEK("day-of-week", 0, 7, List.of("sun", "mon", "tue", "wed", "thu", "fri", "sat"));

    private final String label;
    private final int min;
    private final int max;
    private final List<String> names;

    CronField(String label, int min, int max, List<String> names) {
        this.label = label;
        this.min = min;
        this.max = max;
        this.names = names;
    }

    BitSet parse(String expression, String token) {
        BitSet values = new BitSet(max + 1);
        for (String part : token.split(",", -1)) {
            if (part.isEmpty()) {
                throw error(expression, "empty list element in '" + token + "'");
            }
            parsePart(expression, part, values);
        }
        if (this == DAY_OF_WEEK && values.get(7)) {
            values.clear(7);
            values.set(0);
        }
        return values;
    }

    private void parsePart(String expression, String part, BitSet values) {
        String range = part;
        int step = 1;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            range = part.substring(0, slash);
            step = number(expression, part.substring(slash + 1), "step");
            if (step <= 0) {
                throw error(expression, "step must be positive in '" + part + "'");
            }
        }

        int start;
        int end;
        if ("*".equals(range)) {
            start = min;
            end = max;
        } else {
            int dash = range.indexOf('-');
            if (dash >= 0) {
                start = value(expression, range.substring(0, dash));
                end = value(expression, range.substring(dash + 1));
                if (start > end) {
                    throw error(expression, "range " + range + " is reversed");
                }
            } else {
                start = value(expression, range);
                end = slash >= 0 ? max : start;
            }
        }

        for (int v = start; v <= end; v += step) {
            values.set(v);
        }
    }

    private int value(String expression, String raw) {
        String token = raw.toLowerCase(Locale.ROOT);
        int named = names.indexOf(token);
        if (named >= 0) {
            return this == MONTH ? named + 1 : named;
        }
        int value = number(expression, raw, "value");
        if (value < min || value > max) {
            throw error(expression, label + " value " + value + " outside " + min + "-" + max);
        }
        return value;
    }

    private int number(String expression, String raw, String what) {
        if (raw.isEmpty() || !raw.chars().allMatch(c -> c >= '0' && c <= '9') || raw.length() > 4) {
            throw error(expression, "bad " + label + " " + what + " '" + raw + "'");
        }
        return Integer.parseInt(raw);
    }

    private CronParseException error(String expression, String message) {
        return new CronParseException(expression, message);
    }
}
