package io.recur4j.utils;

import io.recur4j.core.Recurrence;
import io.recur4j.exception.JobValidationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Computes the next run time of a {@link Recurrence}.
 * <p>
 * The result is always strictly after the reference time: a candidate equal to the
 * reference is rolled forward by one period, so a job never re-triggers in the scan
 * that just ran it.
 */
public final class RecurrenceCalculator {
    private RecurrenceCalculator() {
    }

    /**
     * Next qualifying time after {@code reference}, evaluating wall-clock fields in {@code zone}.
     */
    public static Instant nextRun(Recurrence rule, Instant reference, ZoneId zone) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        return nextRun(rule, ZonedDateTime.ofInstant(reference, zone)).toInstant();
    }

    /**
     * Next qualifying time after {@code reference}. Field ranges are not checked.
     */
    public static ZonedDateTime nextRun(Recurrence rule, ZonedDateTime reference) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(reference, "reference must not be null");

        /* =========================================================
         * Hourly: this hour at :minute, else next hour
         * ========================================================= */
        if (rule instanceof Recurrence.Hourly hourly) {
            ZonedDateTime candidate = reference.truncatedTo(ChronoUnit.HOURS)
                    .plusMinutes(hourly.minute());
            if (!candidate.isAfter(reference)) {
                candidate = candidate.plusHours(1);
            }
            return candidate;
        }

        /* =========================================================
         * Daily: today at hour:minute, else tomorrow
         * ========================================================= */
        if (rule instanceof Recurrence.Daily daily) {
            ZonedDateTime candidate = atTimeOfDay(reference, daily.hour(), daily.minute());
            if (!candidate.isAfter(reference)) {
                candidate = candidate.plusDays(1);
            }
            return candidate;
        }

        /* =========================================================
         * Weekly: first matching weekday from today, else a week later
         * ========================================================= */
        Recurrence.Weekly weekly = (Recurrence.Weekly) rule;
        int today = Recurrence.fromDayOfWeek(reference.getDayOfWeek());
        int offset = Math.floorMod(weekly.dayOfWeek() - today, 7);
        ZonedDateTime candidate = atTimeOfDay(reference.plusDays(offset), weekly.hour(), weekly.minute());
        if (!candidate.isAfter(reference)) {
            candidate = candidate.plusDays(7);
        }
        return candidate;
    }

    /**
     * Rejects out-of-range fields: minute 0..59, hour 0..23, dayOfWeek 0..6.
     */
    public static void validate(Recurrence rule) {
        if (rule == null) {
            throw new JobValidationException("Recurrence is required");
        }
        if (rule instanceof Recurrence.Hourly hourly) {
            checkRange("minute", hourly.minute(), 59);
        } else if (rule instanceof Recurrence.Daily daily) {
            checkRange("hour", daily.hour(), 23);
            checkRange("minute", daily.minute(), 59);
        } else if (rule instanceof Recurrence.Weekly weekly) {
            checkRange("dayOfWeek", weekly.dayOfWeek(), 6);
            checkRange("hour", weekly.hour(), 23);
            checkRange("minute", weekly.minute(), 59);
        }
    }

    /* ================= helper ================= */

    private static ZonedDateTime atTimeOfDay(ZonedDateTime day, int hour, int minute) {
        // wall-clock arithmetic; out-of-range fields overflow into the next hour/day
        LocalDateTime local = day.toLocalDate().atStartOfDay()
                .plusHours(hour)
                .plusMinutes(minute);
        return ZonedDateTime.of(local, day.getZone());
    }

    private static void checkRange(String field, int value, int max) {
        if (value < 0 || value > max) {
            throw new JobValidationException(field + " must be between 0 and " + max + ": " + value);
        }
    }
}
