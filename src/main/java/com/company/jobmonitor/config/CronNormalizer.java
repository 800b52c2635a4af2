package com.company.jobmonitor.config;

import com.company.jobmonitor.exception.InvalidCronExpressionException;

/**
 * Normalizes configured cron expressions to the six-field, seconds-first form.
 */
public final class CronNormalizer {

    private CronNormalizer() {
    }

    /**
     * Five-field input gets a literal {@code 0} seconds field prepended; six-field
     * input is returned with its whitespace collapsed.
     */
    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException("Cron expression is empty");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length == 5) {
            return "0 " + String.join(" ", parts);
        }
        if (parts.length == 6) {
            return String.join(" ", parts);
        }
        throw new InvalidCronExpressionException(String.format(
                "Cron expression '%s' must have 5 or 6 fields, found %d", expression, parts.length));
    }
}
