package com.company.jobmonitor.util;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public class TimeUtils {

    private static final DateTimeFormatter UTC_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    public static String formatInstant(Instant instant) {
        if (instant == null) return "none";
        return UTC_FORMAT.format(instant);
    }

    /**
     * Human readable duration, e.g. {@code 1h 45m}, {@code 12m 5s}, {@code 40s}.
     */
    public static String formatDuration(Duration duration) {
        if (duration == null) return null;

        long totalSeconds = Math.abs(duration.getSeconds());
        long days = totalSeconds / 86400;
        long hours = (totalSeconds % 86400) / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        String sign = duration.isNegative() ? "-" : "";

        if (days > 0) {
            return String.format("%s%dd %dh", sign, days, hours);
        } else if (hours > 0) {
            return String.format("%s%dh %dm", sign, hours, minutes);
        } else if (minutes > 0) {
            return String.format("%s%dm %ds", sign, minutes, seconds);
        } else {
            return String.format("%s%ds", sign, seconds);
        }
    }

    public static long minutesBetween(Instant from, Instant to) {
        if (from == null || to == null) return 0;
        return Duration.between(from, to).toMinutes();
    }
}
