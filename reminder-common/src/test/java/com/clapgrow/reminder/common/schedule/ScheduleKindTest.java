package com.clapgrow.reminder.common.schedule;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleKindTest {

    private Locale previousLocale;

    @BeforeEach
    void setUp() {
        previousLocale = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(previousLocale);
    }

    @Test
    void testFromColumnValue_TurkishDefaultLocale_ParsesDottedI() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        assertEquals(ScheduleKind.INTERVAL, ScheduleKind.fromColumnValue("interval"));
        assertEquals(ScheduleKind.DAILY, ScheduleKind.fromColumnValue("daily"));
        assertEquals("interval", ScheduleKind.INTERVAL.toColumnValue());
    }

    @Test
    void testFromColumnValue_MixedCase_Parses() {
        assertEquals(ScheduleKind.MONTHLY, ScheduleKind.fromColumnValue(" Monthly "));
    }

    @Test
    void testFromColumnValue_Unknown_Throws() {
        assertThrows(InvalidScheduleException.class, () -> ScheduleKind.fromColumnValue("hourly"));
        assertThrows(InvalidScheduleException.class, () -> ScheduleKind.fromColumnValue(" "));
    }
}
