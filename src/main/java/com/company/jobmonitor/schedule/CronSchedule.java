package com.company.jobmonitor.schedule;

import com.company.jobmonitor.exception.InvalidCronExpressionException;
import com.company.jobmonitor.exception.ScheduleUnsatisfiableException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Six-field cron schedule (second, minute, hour, day-of-month, month, day-of-week),
 * evaluated at second granularity in UTC.
 * <p>
 * Day-of-month and day-of-week combine by disjunction when both are restricted,
 * following the classic cron rule; when either one is the bare {@code *} wildcard
 * only the other one decides.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class CronSchedule {

    /** Look-back and look-ahead bound; covers a full leap-year cycle. */
    static final int SEARCH_WINDOW_YEARS = 5;

    private static final ZoneOffset UTC = ZoneOffset.UTC;

    private final String expression;
    private final CronField seconds;
    private final CronField minutes;
    private final CronField hours;
    private final CronField daysOfMonth;
    private final CronField months;
    private final CronField daysOfWeek;

    private CronSchedule(String expression, CronField[] fields) {
        this.expression = expression;
        this.seconds = fields[0];
        this.minutes = fields[1];
        this.hours = fields[2];
        this.daysOfMonth = fields[3];
        this.months = fields[4];
        this.daysOfWeek = fields[5];
    }

    /**
     * Parses a normalized six-field expression. Five-field input must be
     * normalized by the caller first.
     *
     * @throws InvalidCronExpressionException if the expression is malformed
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException("Cron expression is empty");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 6) {
            throw new InvalidCronExpressionException(String.format(
                    "Cron expression '%s' must have 6 fields, found %d", expression, parts.length));
        }

        CronField.Type[] types = CronField.Type.values();
        CronField[] fields = new CronField[6];
        for (int i = 0; i < 6; i++) {
            try {
                fields[i] = CronField.parse(types[i], parts[i]);
            } catch (InvalidCronExpressionException e) {
                throw new InvalidCronExpressionException(
                        "Invalid cron expression '" + expression + "': " + e.getMessage(), e);
            }
        }
        return new CronSchedule(String.join(" ", parts), fields);
    }

    /**
     * Latest instant at or before {@code now} matched by this schedule.
     *
     * @throws ScheduleUnsatisfiableException if nothing matches within the look-back window
     */
    public Instant mostRecentDue(Instant now) {
        LocalDateTime t = LocalDateTime.ofInstant(now, UTC).truncatedTo(ChronoUnit.SECONDS);
        LocalDateTime limit = t.minusYears(SEARCH_WINDOW_YEARS);

        while (!t.isBefore(limit)) {
            if (!months.matches(t.getMonthValue())) {
                t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).minusSeconds(1);
                continue;
            }
            if (!dayMatches(t.toLocalDate())) {
                t = t.truncatedTo(ChronoUnit.DAYS).minusSeconds(1);
                continue;
            }

            Integer hour = hours.floor(t.getHour());
            if (hour == null) {
                t = t.truncatedTo(ChronoUnit.DAYS).minusSeconds(1);
                continue;
            }
            if (hour < t.getHour()) {
                t = t.withHour(hour).withMinute(59).withSecond(59);
            }

            Integer minute = minutes.floor(t.getMinute());
            if (minute == null) {
                t = t.truncatedTo(ChronoUnit.HOURS).minusSeconds(1);
                continue;
            }
            if (minute < t.getMinute()) {
                t = t.withMinute(minute).withSecond(59);
            }

            Integer second = seconds.floor(t.getSecond());
            if (second == null) {
                t = t.truncatedTo(ChronoUnit.MINUTES).minusSeconds(1);
                continue;
            }
            return t.withSecond(second).toInstant(UTC);
        }
        throw new ScheduleUnsatisfiableException(expression, now);
    }

    /**
     * Earliest instant strictly after {@code reference} matched by this schedule.
     *
     * @throws ScheduleUnsatisfiableException if nothing matches within the look-ahead window
     */
    public Instant nextAfter(Instant reference) {
        LocalDateTime t = LocalDateTime.ofInstant(reference, UTC)
                .truncatedTo(ChronoUnit.SECONDS)
                .plusSeconds(1);
        LocalDateTime limit = t.plusYears(SEARCH_WINDOW_YEARS);

        while (!t.isAfter(limit)) {
            if (!months.matches(t.getMonthValue())) {
                t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!dayMatches(t.toLocalDate())) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }

            Integer hour = hours.ceiling(t.getHour());
            if (hour == null) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (hour > t.getHour()) {
                t = t.truncatedTo(ChronoUnit.DAYS).withHour(hour);
            }

            Integer minute = minutes.ceiling(t.getMinute());
            if (minute == null) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (minute > t.getMinute()) {
                t = t.truncatedTo(ChronoUnit.HOURS).withMinute(minute);
            }

            Integer second = seconds.ceiling(t.getSecond());
            if (second == null) {
                t = t.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
                continue;
            }
            return t.withSecond(second).toInstant(UTC);
        }
        throw new ScheduleUnsatisfiableException(expression, reference);
    }

    /** Whether {@code instant}, truncated to the second, is a scheduled instant. */
    public boolean matches(Instant instant) {
        LocalDateTime t = LocalDateTime.ofInstant(instant, UTC);
        return months.matches(t.getMonthValue())
                && dayMatches(t.toLocalDate())
                && hours.matches(t.getHour())
                && minutes.matches(t.getMinute())
                && seconds.matches(t.getSecond());
    }

    private boolean dayMatches(LocalDate date) {
        boolean domRestricted = !daysOfMonth.isUnrestricted();
        boolean dowRestricted = !daysOfWeek.isUnrestricted();
        boolean domMatch = daysOfMonth.matches(date.getDayOfMonth());
        // ISO Monday=1..Sunday=7, cron Sunday=0
        boolean dowMatch = daysOfWeek.matches(date.getDayOfWeek().getValue() % 7);

        if (domRestricted && dowRestricted) {
            return domMatch || dowMatch;
        }
        if (domRestricted) {
            return domMatch;
        }
        if (dowRestricted) {
            return dowMatch;
        }
        return true;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronSchedule)) return false;
        CronSchedule that = (CronSchedule) o;
        return expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression);
    }

    @Override
    public String toString() {
        return expression;
    }
}
