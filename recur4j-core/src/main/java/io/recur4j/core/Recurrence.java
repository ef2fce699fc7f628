package io.recur4j.core;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;

/**
 * Recurrence rule of a job. Each variant only carries the fields it uses,
 * so a day of week on an hourly rule cannot be expressed.
 *
 * <p>Field ranges (minute 0..59, hour 0..23, dayOfWeek 0=Sunday..6=Saturday) are not
 * enforced here; see {@link io.recur4j.utils.RecurrenceCalculator#validate(Recurrence)}.
 */
public sealed interface Recurrence permits Recurrence.Hourly, Recurrence.Daily, Recurrence.Weekly {

    RecurrenceType type();

    /**
     * Human readable label, e.g. "Weekly on Wednesday at 09:00".
     */
    String describe();

    record Hourly(int minute) implements Recurrence {
        @Override
        public RecurrenceType type() {
            return RecurrenceType.HOURLY;
        }

        @Override
        public String describe() {
            return String.format("Hourly at :%02d", minute);
        }
    }

    record Daily(int hour, int minute) implements Recurrence {
        @Override
        public RecurrenceType type() {
            return RecurrenceType.DAILY;
        }

        @Override
        public String describe() {
            return String.format("Daily at %02d:%02d", hour, minute);
        }
    }

    record Weekly(int dayOfWeek, int hour, int minute) implements Recurrence {
        @Override
        public RecurrenceType type() {
            return RecurrenceType.WEEKLY;
        }

        @Override
        public String describe() {
            String day = dayOfWeek >= 0 && dayOfWeek <= 6
                    ? toDayOfWeek(dayOfWeek).getDisplayName(TextStyle.FULL, Locale.ENGLISH)
                    : "day " + dayOfWeek;
            return String.format("Weekly on %s at %02d:%02d", day, hour, minute);
        }
    }

    /**
     * Build a rule from loosely typed fields, e.g. a form submission.
     * Absent fields default to 0; fields the variant does not use are ignored.
     */
    static Recurrence of(RecurrenceType type, Integer minute, Integer hour, Integer dayOfWeek) {
        Objects.requireNonNull(type, "type must not be null");
        int m = minute == null ? 0 : minute;
        int h = hour == null ? 0 : hour;
        int d = dayOfWeek == null ? 0 : dayOfWeek;
        return switch (type) {
            case HOURLY -> new Hourly(m);
            case DAILY -> new Daily(h, m);
            case WEEKLY -> new Weekly(d, h, m);
        };
    }

    /**
     * Maps 0=Sunday..6=Saturday onto {@link DayOfWeek}.
     */
    static DayOfWeek toDayOfWeek(int sundayBased) {
        return sundayBased == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(sundayBased);
    }

    /**
     * Maps {@link DayOfWeek} onto 0=Sunday..6=Saturday.
     */
    static int fromDayOfWeek(DayOfWeek day) {
        return day.getValue() % 7;
    }
}
