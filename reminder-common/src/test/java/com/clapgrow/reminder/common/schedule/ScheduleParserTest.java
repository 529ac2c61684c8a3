package com.clapgrow.reminder.common.schedule;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.Month;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleParserTest {

    private static final ZoneId DEFAULT_ZONE = ZoneId.of("Asia/Tehran");

    private final ScheduleParser parser = new ScheduleParser(DEFAULT_ZONE);

    @Test
    void testParseOnce() {
        Instant at = Instant.parse("2024-06-01T10:00:00Z");

        Schedule schedule = parser.parse(new ScheduleColumns("once", "Europe/Berlin", at, null, null, null, null, null));

        Schedule.Once once = assertInstanceOf(Schedule.Once.class, schedule);
        assertEquals(at, once.at());
        assertEquals(ZoneId.of("Europe/Berlin"), once.zone());
        assertFalse(once.isRecurring());
    }

    @Test
    void testParseWeeklyMapsZeroToSunday() {
        Schedule schedule = parser.parse(new ScheduleColumns("weekly", null, null, null, "09:00", 0, null, null));

        Schedule.Weekly weekly = assertInstanceOf(Schedule.Weekly.class, schedule);
        assertEquals(DayOfWeek.SUNDAY, weekly.dayOfWeek());
        assertEquals(LocalTime.of(9, 0), weekly.time());
        assertEquals(DEFAULT_ZONE, weekly.zone());
    }

    @Test
    void testParseWeeklyMapsSixToSaturday() {
        Schedule schedule = parser.parse(new ScheduleColumns("WEEKLY", "  ", null, null, "18:45", 6, null, null));

        assertEquals(DayOfWeek.SATURDAY, ((Schedule.Weekly) schedule).dayOfWeek());
    }

    @Test
    void testParseYearly() {
        Schedule schedule = parser.parse(new ScheduleColumns("yearly", "UTC", null, null, "07:15", null, 29, 2));

        Schedule.Yearly yearly = assertInstanceOf(Schedule.Yearly.class, schedule);
        assertEquals(Month.FEBRUARY, yearly.month());
        assertEquals(29, yearly.dayOfMonth());
    }

    @Test
    void testMissingKindSpecificColumnIsRejected() {
        InvalidScheduleException e = assertThrows(InvalidScheduleException.class,
            () -> parser.parse(new ScheduleColumns("daily", null, null, null, null, null, null, null)));
        assertTrue(e.getMessage().contains("at_time"));

        assertThrows(InvalidScheduleException.class,
            () -> parser.parse(new ScheduleColumns("monthly", null, null, null, "10:00", null, null, null)));
        assertThrows(InvalidScheduleException.class,
            () -> parser.parse(new ScheduleColumns("once", null, null, null, null, null, null, null)));
    }

    @Test
    void testOutOfRangeValuesAreRejected() {
        assertThrows(InvalidScheduleException.class,
            () -> parser.parse(new ScheduleColumns("weekly", null, null, null, "09:00", 7, null, null)));
        assertThrows(InvalidScheduleException.class,
            () -> parser.parse(new ScheduleColumns("monthly", null, null, null, "09:00", null, 32, null)));
        assertThrows(InvalidScheduleException.class,
            () -> parser.parse(new ScheduleColumns("yearly", null, null, null, "09:00", null, 31, 4)));
        assertThrows(InvalidScheduleException.class,
            () -> parser.parse(new ScheduleColumns("interval", null, null, 0, null, null, null, null)));
        assertThrows(InvalidScheduleException.class,
            () -> parser.parse(new ScheduleColumns("daily", null, null, null, "25:00", null, null, null)));
    }

    @Test
    void testUnknownTypeAndZoneAreRejected() {
        assertThrows(InvalidScheduleException.class,
            () -> parser.parse(new ScheduleColumns("hourly", null, null, 5, null, null, null, null)));
        assertThrows(InvalidScheduleException.class,
            () -> parser.parse(new ScheduleColumns("daily", "Mars/Olympus", null, null, "09:00", null, null, null)));
    }
}
