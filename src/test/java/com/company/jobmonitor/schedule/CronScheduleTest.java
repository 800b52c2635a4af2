package com.company.jobmonitor.schedule;

import com.company.jobmonitor.config.CronNormalizer;
import com.company.jobmonitor.exception.InvalidCronExpressionException;
import com.company.jobmonitor.exception.ScheduleUnsatisfiableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Cron schedule evaluation")
class CronScheduleTest {

    private static Instant at(String iso) {
        return Instant.parse(iso);
    }

    @Test
    @DisplayName("daily 02:00 measured at 03:45 is due at 02:00 the same day")
    void daily_schedule_most_recent_due() {
        CronSchedule schedule = CronSchedule.parse("0 0 2 * * *");

        assertThat(schedule.mostRecentDue(at("2025-01-02T03:45:00Z"))).isEqualTo(at("2025-01-02T02:00:00Z"));
        assertThat(schedule.mostRecentDue(at("2025-01-02T01:59:59Z"))).isEqualTo(at("2025-01-01T02:00:00Z"));
    }

    @Test
    @DisplayName("hourly five-field input normalizes and is due at the top of the hour")
    void normalized_hourly_schedule() {
        CronSchedule schedule = CronSchedule.parse(CronNormalizer.normalize("0 * * * *"));

        assertThat(schedule.getExpression()).isEqualTo("0 0 * * * *");
        assertThat(schedule.mostRecentDue(at("2025-03-01T10:34:00Z"))).isEqualTo(at("2025-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("an instant that matches exactly is its own due instant")
    void exact_match_is_inclusive() {
        CronSchedule schedule = CronSchedule.parse("0 0 2 * * *");

        assertThat(schedule.mostRecentDue(at("2025-01-02T02:00:00Z"))).isEqualTo(at("2025-01-02T02:00:00Z"));
        assertThat(schedule.mostRecentDue(at("2025-01-02T02:00:00.750Z"))).isEqualTo(at("2025-01-02T02:00:00Z"));
    }

    @Test
    @DisplayName("second-level steps are honoured")
    void second_granularity() {
        CronSchedule schedule = CronSchedule.parse("*/15 * * * * *");

        assertThat(schedule.mostRecentDue(at("2025-01-02T10:00:44Z"))).isEqualTo(at("2025-01-02T10:00:30Z"));
        assertThat(schedule.nextAfter(at("2025-01-02T10:00:45Z"))).isEqualTo(at("2025-01-02T10:01:00Z"));
    }

    @Test
    @DisplayName("due search rolls back across month and year boundaries")
    void rolls_back_across_year() {
        CronSchedule schedule = CronSchedule.parse("0 30 23 31 12 *");

        assertThat(schedule.mostRecentDue(at("2025-06-15T12:00:00Z"))).isEqualTo(at("2024-12-31T23:30:00Z"));
        assertThat(schedule.nextAfter(at("2025-06-15T12:00:00Z"))).isEqualTo(at("2025-12-31T23:30:00Z"));
    }

    @Test
    @DisplayName("Feb 29 schedules reach back to the previous leap year")
    void leap_day() {
        CronSchedule schedule = CronSchedule.parse("0 0 0 29 2 *");

        assertThat(schedule.mostRecentDue(at("2027-06-01T00:00:00Z"))).isEqualTo(at("2024-02-29T00:00:00Z"));
        assertThat(schedule.nextAfter(at("2025-06-01T00:00:00Z"))).isEqualTo(at("2028-02-29T00:00:00Z"));
    }

    @Test
    @DisplayName("restricted day-of-month and day-of-week match when either one does")
    void day_fields_combine_by_or() {
        // 2025-05-13 is a Tuesday; the previous Friday was 2025-05-09
        CronSchedule both = CronSchedule.parse("0 0 0 13 * 5");
        CronSchedule fridays = CronSchedule.parse("0 0 0 * * 5");
        CronSchedule thirteenth = CronSchedule.parse("0 0 0 13 * *");
        Instant now = at("2025-05-14T12:00:00Z");

        assertThat(both.mostRecentDue(now)).isEqualTo(at("2025-05-13T00:00:00Z"));
        assertThat(fridays.mostRecentDue(now)).isEqualTo(at("2025-05-09T00:00:00Z"));
        assertThat(thirteenth.mostRecentDue(now)).isEqualTo(at("2025-05-13T00:00:00Z"));
        assertThat(both.nextAfter(now)).isEqualTo(at("2025-05-16T00:00:00Z"));
    }

    @Test
    @DisplayName("day-of-week uses 0 for Sunday")
    void sunday_is_zero() {
        CronSchedule sundays = CronSchedule.parse("0 0 12 * * 0");
        CronSchedule weekdays = CronSchedule.parse("0 30 9 * * 1-5");

        // 2025-06-01 is a Sunday
        assertThat(sundays.mostRecentDue(at("2025-06-03T00:00:00Z"))).isEqualTo(at("2025-06-01T12:00:00Z"));
        assertThat(weekdays.mostRecentDue(at("2025-06-01T08:00:00Z"))).isEqualTo(at("2025-05-30T09:30:00Z"));
    }

    @Test
    @DisplayName("a schedule that can never match is reported, not treated as never due")
    void impossible_schedule_is_unsatisfiable() {
        CronSchedule schedule = CronSchedule.parse("0 0 0 31 2 *");

        assertThatThrownBy(() -> schedule.mostRecentDue(at("2025-01-02T00:00:00Z")))
                .isInstanceOf(ScheduleUnsatisfiableException.class)
                .hasMessageContaining("0 0 0 31 2 *");
        assertThatThrownBy(() -> schedule.nextAfter(at("2025-01-02T00:00:00Z")))
                .isInstanceOf(ScheduleUnsatisfiableException.class);
    }

    @Test
    @DisplayName("only six-field expressions are accepted by the evaluator")
    void requires_six_fields() {
        assertThatThrownBy(() -> CronSchedule.parse("0 * * * *"))
                .isInstanceOf(InvalidCronExpressionException.class)
                .hasMessageContaining("6 fields");
        assertThatThrownBy(() -> CronSchedule.parse("0 0 0 * * * 2025"))
                .isInstanceOf(InvalidCronExpressionException.class);
        assertThatThrownBy(() -> CronSchedule.parse("0 0 25 * * *"))
                .isInstanceOf(InvalidCronExpressionException.class)
                .hasMessageContaining("hour");
    }

    @Test
    @DisplayName("five-field input gives the same due instants as its six-field equivalent")
    void five_field_normalization_is_equivalent() {
        CronSchedule normalized = CronSchedule.parse(CronNormalizer.normalize("30 2 * * 1-5"));
        CronSchedule explicit = CronSchedule.parse("0 30 2 * * 1-5");
        Random random = new Random(42);
        Instant base = at("2024-01-01T00:00:00Z");

        for (int i = 0; i < 200; i++) {
            Instant t = base.plusSeconds(random.nextInt(3 * 365 * 24 * 3600));
            assertThat(normalized.mostRecentDue(t)).isEqualTo(explicit.mostRecentDue(t));
        }
    }

    @Test
    @DisplayName("due instants never lie after now, and nothing matches between due and now")
    void most_recent_due_is_tight() {
        List<String> expressions = List.of(
                "0 0 2 * * *",
                "*/15 * * * * *",
                "0 */7 * * * *",
                "0 0 0 13 * 5",
                "0 0 9-17/2 * * 1-5",
                "30 45 23 1,15 * *",
                "0 0 0 29 2 *",
                "5,10 0 12 * 6 0");
        Random random = new Random(7);
        Instant base = at("2023-01-01T00:00:00Z");

        for (String expression : expressions) {
            CronSchedule schedule = CronSchedule.parse(expression);
            for (int i = 0; i < 50; i++) {
                Instant t = base.plusSeconds(random.nextInt(4 * 365 * 24 * 3600));

                Instant due = schedule.mostRecentDue(t);

                assertThat(due).as("%s at %s", expression, t).isBeforeOrEqualTo(t);
                assertThat(schedule.matches(due)).as("%s matches %s", expression, due).isTrue();
                Instant next = schedule.nextAfter(due);
                assertThat(next).as("%s next after %s", expression, due).isAfter(t.minusNanos(t.getNano()));
                assertThat(schedule.matches(next)).isTrue();
            }
        }
    }

    @Test
    @DisplayName("brute-force check against second-by-second scan for a dense schedule")
    void agrees_with_linear_scan() {
        CronSchedule schedule = CronSchedule.parse("10,40 */5 * * * *");
        Instant t = at("2025-07-04T13:22:17Z");

        Instant expected = t;
        while (!schedule.matches(expected)) {
            expected = expected.minus(Duration.ofSeconds(1));
        }
        assertThat(schedule.mostRecentDue(t)).isEqualTo(expected).isEqualTo(at("2025-07-04T13:20:40Z"));
    }

    @Test
    @DisplayName("a step wider than the field evaluates like its start value")
    void huge_step_evaluates() {
        CronSchedule schedule = CronSchedule.parse("1/2147483647 * * * * *");

        assertThat(schedule.mostRecentDue(at("2025-01-02T03:45:00Z"))).isEqualTo(at("2025-01-02T03:44:01Z"));
    }
}
