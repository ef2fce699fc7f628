package io.recur4j.utils;

import io.recur4j.core.Recurrence;
import io.recur4j.exception.JobValidationException;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Parses the compact text form of a {@link Recurrence}.
 * <p>
 * Supported formats (case-insensitive):
 * <ul>
 *   <li>{@code hourly}, {@code hourly :30}, {@code hourly 30}</li>
 *   <li>{@code daily 09:15} (time defaults to 00:00)</li>
 *   <li>{@code weekly wed 09:00}; the day is 0=Sunday..6=Saturday or an English day name or abbreviation</li>
 * </ul>
 * Parsed rules are validated with {@link RecurrenceCalculator#validate(Recurrence)}.
 */
public final class RecurrenceParser {
    private RecurrenceParser() {
    }

    public static Recurrence parse(String text) {
        if (text == null) {
            throw new JobValidationException("Recurrence must not be null");
        }
        String s = text.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new JobValidationException("Recurrence must not be empty");
        }

        String[] parts = s.split("\\s+");
        Recurrence rule = switch (parts[0]) {
            case "hourly" -> parseHourly(parts, text);
            case "daily" -> parseDaily(parts, text);
            case "weekly" -> parseWeekly(parts, text);
            default -> throw new JobValidationException("Unsupported recurrence type: " + parts[0]);
        };

        RecurrenceCalculator.validate(rule);
        return rule;
    }

    /**
     * Inverse of {@link #parse(String)}.
     */
    public static String format(Recurrence rule) {
        if (rule instanceof Recurrence.Hourly hourly) {
            return String.format("hourly :%02d", hourly.minute());
        }
        if (rule instanceof Recurrence.Daily daily) {
            return String.format("daily %02d:%02d", daily.hour(), daily.minute());
        }
        Recurrence.Weekly weekly = (Recurrence.Weekly) rule;
        String day = Recurrence.toDayOfWeek(weekly.dayOfWeek())
                .getDisplayName(TextStyle.SHORT, Locale.ENGLISH)
                .toLowerCase(Locale.ROOT);
        return String.format("weekly %s %02d:%02d", day, weekly.hour(), weekly.minute());
    }

    /* ================= helper ================= */

    private static Recurrence parseHourly(String[] parts, String text) {
        expectAtMost(parts, 2, text);
        if (parts.length == 1) {
            return new Recurrence.Hourly(0);
        }
        String minute = parts[1].startsWith(":") ? parts[1].substring(1) : parts[1];
        return new Recurrence.Hourly(parseNumber(minute, "minute"));
    }

    private static Recurrence parseDaily(String[] parts, String text) {
        expectAtMost(parts, 2, text);
        if (parts.length == 1) {
            return new Recurrence.Daily(0, 0);
        }
        int[] time = parseTimeOfDay(parts[1]);
        return new Recurrence.Daily(time[0], time[1]);
    }

    private static Recurrence parseWeekly(String[] parts, String text) {
        expectAtMost(parts, 3, text);
        if (parts.length < 2) {
            throw new JobValidationException("Weekly recurrence requires a day: " + text);
        }
        int day = parseDay(parts[1]);
        if (parts.length == 2) {
            return new Recurrence.Weekly(day, 0, 0);
        }
        int[] time = parseTimeOfDay(parts[2]);
        return new Recurrence.Weekly(day, time[0], time[1]);
    }

    private static int parseDay(String token) {
        if (token.matches("^\\d+$")) {
            return parseNumber(token, "dayOfWeek");
        }
        for (DayOfWeek day : DayOfWeek.values()) {
            String full = day.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
            if (full.equals(token) || (token.length() >= 3 && full.startsWith(token))) {
                return Recurrence.fromDayOfWeek(day);
            }
        }
        throw new JobValidationException("Invalid day of week: " + token);
    }

    private static int[] parseTimeOfDay(String token) {
        String[] hm = token.split(":");
        if (hm.length != 2) {
            throw new JobValidationException("Invalid time of day. Expected HH:mm: " + token);
        }
        return new int[]{parseNumber(hm[0], "hour"), parseNumber(hm[1], "minute")};
    }

    private static int parseNumber(String token, String field) {
        if (!token.matches("^\\d{1,2}$")) {
            throw new JobValidationException("Invalid " + field + ": " + token);
        }
        return Integer.parseInt(token);
    }

    private static void expectAtMost(String[] parts, int max, String text) {
        if (parts.length > max) {
            throw new JobValidationException("Unexpected trailing input in recurrence: " + text);
        }
    }
}
