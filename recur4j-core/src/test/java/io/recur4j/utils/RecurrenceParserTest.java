package io.recur4j.utils;

import io.recur4j.core.Recurrence;
import io.recur4j.exception.JobValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecurrenceParserTest {

    @Test
    void parseHourlyShouldAcceptColonAndBareMinute() {
        assertEquals(new Recurrence.Hourly(30), RecurrenceParser.parse("hourly :30"));
        assertEquals(new Recurrence.Hourly(5), RecurrenceParser.parse("HOURLY 5"));
        assertEquals(new Recurrence.Hourly(0), RecurrenceParser.parse("hourly"));
    }

    @Test
    void parseDailyShouldReadTimeOfDay() {
        assertEquals(new Recurrence.Daily(9, 15), RecurrenceParser.parse("daily 09:15"));
        assertEquals(new Recurrence.Daily(0, 0), RecurrenceParser.parse("  daily "));
    }

    @Test
    void parseWeeklyShouldAcceptDayNamesAndNumbers() {
        assertEquals(new Recurrence.Weekly(3, 9, 0), RecurrenceParser.parse("weekly wed 09:00"));
        assertEquals(new Recurrence.Weekly(0, 23, 59), RecurrenceParser.parse("weekly Sunday 23:59"));
        assertEquals(new Recurrence.Weekly(6, 0, 0), RecurrenceParser.parse("weekly 6"));
    }

    @Test
    void parseShouldRejectInvalidInput() {
        assertThrows(JobValidationException.class, () -> RecurrenceParser.parse("monthly 1"));
        assertThrows(JobValidationException.class, () -> RecurrenceParser.parse(""));
        assertThrows(JobValidationException.class, () -> RecurrenceParser.parse("daily 24:00"));
        assertThrows(JobValidationException.class, () -> RecurrenceParser.parse("daily 9"));
        assertThrows(JobValidationException.class, () -> RecurrenceParser.parse("weekly"));
        assertThrows(JobValidationException.class, () -> RecurrenceParser.parse("weekly xyz 09:00"));
        assertThrows(JobValidationException.class, () -> RecurrenceParser.parse("weekly 7 09:00"));
        assertThrows(JobValidationException.class, () -> RecurrenceParser.parse("hourly :30 extra"));
    }

    @Test
    void formatShouldProduceParseableText() {
        Recurrence weekly = new Recurrence.Weekly(4, 18, 5);
        assertEquals("weekly thu 18:05", RecurrenceParser.format(weekly));
        assertEquals(weekly, RecurrenceParser.parse(RecurrenceParser.format(weekly)));
        assertEquals("hourly :07", RecurrenceParser.format(new Recurrence.Hourly(7)));
    }

    @Test
    void describeShouldNameTheSchedule() {
        assertEquals("Weekly on Wednesday at 09:00", new Recurrence.Weekly(3, 9, 0).describe());
        assertEquals("Hourly at :30", new Recurrence.Hourly(30).describe());
        assertEquals("Daily at 02:05", new Recurrence.Daily(2, 5).describe());
    }
}
