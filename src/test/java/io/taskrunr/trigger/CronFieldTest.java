package io.taskrunr.trigger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CronFieldTest {

    @Test
    void wildcardShouldMatchWholeRange() {
        CronField field = CronField.parse("hour", "*", 0, 23);

        assertEquals("0,1,2,3,4,5,6", CronField.parse("day_of_week", "*", 0, 6).values());
        assertTrue(field.values().startsWith("0,1,"));
        assertTrue(field.values().endsWith(",22,23"));
    }

    @Test
    void stepShouldStartAtMinimum() {
        CronField field = CronField.parse("day", "*/10", 1, 31);

        assertEquals("1,11,21,31", field.values());
    }

    @Test
    void listShouldCombineValuesAndRanges() {
        CronField field = CronField.parse("minute", "0,15-17,45", 0, 59);

        assertEquals("0,15,16,17,45", field.values());
        assertEquals("0,15-17,45", field.literal());
    }

    @Test
    void shouldRejectEmptyListItems() {
        assertThrows(ScheduleParseException.class, () -> CronField.parse("minute", "1,,2", 0, 59));
        assertThrows(ScheduleParseException.class, () -> CronField.parse("minute", "1,", 0, 59));
        assertThrows(ScheduleParseException.class, () -> CronField.parse("minute", "", 0, 59));
    }

    @Test
    void errorShouldNameTheField() {
        var e = assertThrows(ScheduleParseException.class, () -> CronField.parse("day_of_week", "8", 0, 6));
        assertTrue(e.getMessage().contains("day_of_week"));
    }
}
