package com.company.jobmonitor.schedule;

import com.company.jobmonitor.exception.InvalidCronExpressionException;

import java.util.Collections;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * One parsed field of a cron expression: the set of accepted values within the
 * field's domain.
 */
public final class CronField {

    public enum Type {
        SECOND("second", 0, 59),
        MINUTE("minute", 0, 59),
        HOUR("hour", 0, 23),
        DAY_OF_MONTH("day-of-month", 1, 31),
        MONTH("month", 1, 12),
        DAY_OF_WEEK("day-of-week", 0, 6);

        private final String label;
        private final int min;
        private final int max;

        Type(String label, int min, int max) {
            this.label = label;
            this.min = min;
            this.max = max;
        }

        public String getLabel() {
            return label;
        }

        public int getMin() {
            return min;
        }

        public int getMax() {
            return max;
        }
    }

    private final Type type;
    private final String source;
    private final NavigableSet<Integer> values;
    private final boolean unrestricted;

    private CronField(Type type, String source, NavigableSet<Integer> values, boolean unrestricted) {
        this.type = type;
        this.source = source;
        this.values = Collections.unmodifiableNavigableSet(values);
        this.unrestricted = unrestricted;
    }

    /**
     * Parses a field made of comma-separated elements. Each element is the
     * wildcard (optionally stepped), {@code a}, {@code a-b}, {@code a-b/n} or {@code a/n}.
     */
    public static CronField parse(Type type, String source) {
        if (source == null || source.isBlank()) {
            throw new InvalidCronExpressionException(type.getLabel() + " field is empty");
        }
        String trimmed = source.trim();
        NavigableSet<Integer> values = new TreeSet<>();

        for (String element : trimmed.split(",", -1)) {
            parseElement(type, element, values);
        }

        if (values.isEmpty()) {
            throw new InvalidCronExpressionException(
                    type.getLabel() + " field '" + trimmed + "' accepts no value");
        }
        return new CronField(type, trimmed, values, "*".equals(trimmed));
    }

    private static void parseElement(Type type, String element, NavigableSet<Integer> values) {
        if (element.isEmpty()) {
            throw new InvalidCronExpressionException(
                    "Empty list element in " + type.getLabel() + " field");
        }

        String rangePart = element;
        int step = 1;
        int slash = element.indexOf('/');
        if (slash >= 0) {
            rangePart = element.substring(0, slash);
            step = parseNumber(type, element.substring(slash + 1), "step");
            if (step <= 0) {
                throw new InvalidCronExpressionException(
                        "Step must be positive in " + type.getLabel() + " field: '" + element + "'");
            }
        }

        int start;
        int end;
        if ("*".equals(rangePart)) {
            start = type.getMin();
            end = type.getMax();
        } else {
            int dash = rangePart.indexOf('-');
            if (dash >= 0) {
                start = parseValue(type, rangePart.substring(0, dash));
                end = parseValue(type, rangePart.substring(dash + 1));
                if (start > end) {
                    throw new InvalidCronExpressionException(
                            "Inverted range in " + type.getLabel() + " field: '" + element + "'");
                }
            } else {
                start = parseValue(type, rangePart);
                // "a/n" runs from a to the end of the domain
                end = slash >= 0 ? type.getMax() : start;
            }
        }

        // long so that a huge step cannot wrap around past the end
        for (long value = start; value <= end; value += step) {
            values.add((int) value);
        }
    }

    private static int parseValue(Type type, String text) {
        int value = parseNumber(type, text, "value");
        if (value < type.getMin() || value > type.getMax()) {
            throw new InvalidCronExpressionException(String.format(
                    "Value %d out of range [%d-%d] for %s field",
                    value, type.getMin(), type.getMax(), type.getLabel()));
        }
        return value;
    }

    private static int parseNumber(Type type, String text, String what) {
        if (text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
            throw new InvalidCronExpressionException(String.format(
                    "Invalid %s '%s' in %s field", what, text, type.getLabel()));
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new InvalidCronExpressionException(String.format(
                    "Invalid %s '%s' in %s field", what, text, type.getLabel()), e);
        }
    }

    public boolean matches(int value) {
        return values.contains(value);
    }

    /** Greatest accepted value less than or equal to {@code value}, or null. */
    public Integer floor(int value) {
        return values.floor(value);
    }

    /** Smallest accepted value greater than or equal to {@code value}, or null. */
    public Integer ceiling(int value) {
        return values.ceiling(value);
    }

    public Type getType() {
        return type;
    }

    public NavigableSet<Integer> getValues() {
        return values;
    }

    /** True only for the bare {@code *} wildcard. */
    public boolean isUnrestricted() {
        return unrestricted;
    }

    @Override
    public String toString() {
        return source;
    }
}
