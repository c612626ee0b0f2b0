package io.taskrunr.trigger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TriggerParserTest {

    // Wednesday
    private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");

    private TriggerParser parser;

    @BeforeEach
    void setUp() {
        parser = new TriggerParser(ZoneId.of("UTC"), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ---- cron ----

    @Test
    void shouldParseCronExpression() {
        TriggerDescriptor trigger = parser.parse("cron:0 9 * * 1-5");

        CronTrigger cron = assertInstanceOf(CronTrigger.class, trigger);
        assertEquals(ScheduleType.CRON, cron.type());
        assertEquals("0 9 * * 1-5", cron.expression());
    }

    @Test
    void weekdayCronShouldSkipWeekend() {
        TriggerDescriptor trigger = parser.parse("cron:0 9 * * 1-5");

        // Friday 10:00 -> Monday 09:00
        Instant next = trigger.nextFireTime(Instant.parse("2025-01-03T10:00:00Z"));
        assertEquals(Instant.parse("2025-01-06T09:00:00Z"), next);
    }

    @Test
    void dayOfWeekZeroShouldBeSunday() {
        Instant next = parser.parse("cron:30 8 * * 0").nextFireTime(NOW);
        assertEquals(Instant.parse("2025-01-05T08:30:00Z"), next);
    }

    @Test
    void dayOfMonthAndDayOfWeekShouldBothMatch() {
        // Friday the 13th
        Instant next = parser.parse("cron:0 0 13 * 5").nextFireTime(NOW);
        assertEquals(Instant.parse("2025-06-13T00:00:00Z"), next);
    }

    @Test
    void shouldSupportStepsAndLists() {
        assertEquals(Instant.parse("2025-01-01T10:15:00Z"), parser.parse("cron:*/15 * * * *").nextFireTime(NOW));
        assertEquals(Instant.parse("2025-01-01T12:05:00Z"), parser.parse("cron:5 8,12,18 * * *").nextFireTime(NOW));
    }

    @Test
    void dayOfWeekStepShouldCountFromSunday() {
        // */2 is Sunday, Tuesday, Thursday and Saturday, so Wednesday is skipped
        Instant next = parser.parse("cron:0 12 * * */2").nextFireTime(NOW);
        assertEquals(Instant.parse("2025-01-02T12:00:00Z"), next);
    }

    @Test
    void cronShouldFireStrictlyAfterGivenInstant() {
        Instant next = parser.parse("cron:0 10 * * *").nextFireTime(NOW);
        assertEquals(Instant.parse("2025-01-02T10:00:00Z"), next);
    }

    @Test
    void impossibleCronShouldNeverFire() {
        assertNull(parser.parse("cron:0 0 31 2 *").nextFireTime(NOW));
    }

    @Test
    void shouldEvaluateCronInConfiguredZone() {
        var brussels = new TriggerParser(ZoneId.of("Europe/Brussels"), Clock.fixed(NOW, ZoneOffset.UTC));

        Instant next = brussels.parse("cron:0 9 * * *").nextFireTime(NOW);
        assertEquals(Instant.parse("2025-01-02T08:00:00Z"), next);
    }

    @Test
    void shouldRejectMalformedCron() {
        assertThrows(ScheduleParseException.class, () -> parser.parse("cron:0 9 * *"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("cron:0 9 * * * *"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("cron:60 * * * *"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("cron:* 24 * * *"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("cron:* * 0 * *"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("cron:* * * 13 *"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("cron:* * * * 7"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("cron:*/0 * * * *"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("cron:5-1 * * * *"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("cron:a * * * *"));
    }

    // ---- interval ----

    @Test
    void intervalShouldFireOnePeriodAfterParseTime() {
        IntervalTrigger trigger = assertInstanceOf(IntervalTrigger.class, parser.parse("every 30m"));

        assertEquals(Duration.ofMinutes(30), trigger.period());
        assertEquals(Instant.parse("2025-01-01T10:30:00Z"), trigger.nextFireTime(NOW));
        assertEquals(Instant.parse("2025-01-01T11:00:00Z"), trigger.nextFireTime(Instant.parse("2025-01-01T10:45:00Z")));
        assertEquals(Instant.parse("2025-01-01T11:00:00Z"), trigger.nextFireTime(Instant.parse("2025-01-01T10:30:00Z")));
    }

    @Test
    void intervalShouldUseStartTimeAsAnchor() {
        Instant start = Instant.parse("2025-01-01T12:00:00Z");
        TriggerDescriptor trigger = parser.parse("every 2h", start);

        assertEquals(Instant.parse("2025-01-01T14:00:00Z"), trigger.nextFireTime(NOW));
    }

    @Test
    void shouldRejectMalformedIntervals() {
        assertThrows(ScheduleParseException.class, () -> parser.parse("every 0s"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("every -5m"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("every 5x"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("every m"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("every 99999999999999999999s"));
    }

    // ---- one-shot ----

    @Test
    void shouldParseAbsoluteDateInConfiguredZone() {
        DateTrigger trigger = assertInstanceOf(DateTrigger.class, parser.parse("at:2025-06-01T00:00:00"));
        assertEquals(Instant.parse("2025-06-01T00:00:00Z"), trigger.runAt());
        assertEquals(ScheduleType.DATE, trigger.type());
    }

    @Test
    void shouldAcceptOffsetsSpacesAndBareDates() {
        assertEquals(Instant.parse("2025-06-01T00:00:00Z"),
                ((DateTrigger) parser.parse("at:2025-06-01T02:00:00+02:00")).runAt());
        assertEquals(Instant.parse("2025-06-01T00:00:00Z"),
                ((DateTrigger) parser.parse("at:2025-06-01T00:00:00Z")).runAt());
        assertEquals(Instant.parse("2025-06-01T08:15:00Z"),
                ((DateTrigger) parser.parse("at:2025-06-01 08:15:00")).runAt());
        assertEquals(Instant.parse("2025-06-01T00:00:00Z"),
                ((DateTrigger) parser.parse("at:2025-06-01")).runAt());
    }

    @Test
    void pastDateShouldStillParse() {
        DateTrigger trigger = (DateTrigger) parser.parse("at:2020-01-01T00:00:00");

        assertEquals(Instant.parse("2020-01-01T00:00:00Z"), trigger.runAt());
        assertNull(trigger.nextFireTime(NOW));
    }

    @Test
    void dateTriggerShouldFireOnce() {
        TriggerDescriptor trigger = parser.parse("at:2025-06-01T00:00:00");

        assertEquals(Instant.parse("2025-06-01T00:00:00Z"), trigger.nextFireTime(NOW));
        assertNull(trigger.nextFireTime(Instant.parse("2025-06-01T00:00:00Z")));
    }

    @Test
    void shouldRejectInvalidDate() {
        assertThrows(ScheduleParseException.class, () -> parser.parse("at:tomorrow"));
        assertThrows(ScheduleParseException.class, () -> parser.parse("at:2025-13-01T00:00:00"));
    }

    @Test
    void relativeSpecShouldResolveFromNow() {
        DateTrigger trigger = (DateTrigger) parser.parse("in 2h");
        assertEquals(NOW.plus(Duration.ofHours(2)), trigger.runAt());
    }

    @Test
    void resolveOneShotShouldMeasureRelativeSpecsFromCreation() {
        Instant createdAt = Instant.parse("2024-12-31T23:00:00Z");

        assertEquals(Instant.parse("2025-01-01T01:00:00Z"), parser.resolveOneShot("in 2h", createdAt));
        assertEquals(Instant.parse("2025-06-01T00:00:00Z"), parser.resolveOneShot("at:2025-06-01T00:00:00", createdAt));
        assertNull(parser.resolveOneShot("cron:0 9 * * *", createdAt));
        assertNull(parser.resolveOneShot("at:garbage", createdAt));
    }

    @Test
    void shouldRejectUnrecognizedFormat() {
        var e = assertThrows(ScheduleParseException.class, () -> parser.parse("bogus"));
        assertTrue(e.getMessage().contains("unrecognized schedule format"));
        assertThrows(ScheduleParseException.class, () -> parser.parse(null));
        assertThrows(ScheduleParseException.class, () -> parser.parse("CRON:0 9 * * *"));
    }

    // ---- human readable ----

    @Test
    void humanReadableShouldPluralizeUnits() {
        assertEquals("Every 1 hour", parser.getHumanReadable("every 1h"));
        assertEquals("Every 2 hours", parser.getHumanReadable("every 2h"));
        assertEquals("Every 1 minute", parser.getHumanReadable("every 1m"));
        assertEquals("Every 45 seconds", parser.getHumanReadable("every 45s"));
        assertEquals("In 3 days", parser.getHumanReadable("in 3d"));
        assertEquals("In 1 day", parser.getHumanReadable("in 1d"));
    }

    @Test
    void humanReadableShouldDescribeCronAndDates() {
        assertEquals("Cron schedule: 0 9 * * 1-5", parser.getHumanReadable("cron:0 9 * * 1-5"));
        assertEquals("At 2025-06-01 12:30:00", parser.getHumanReadable("at:2025-06-01T12:30:00"));
    }

    @Test
    void humanReadableShouldKeepWrittenOffset() {
        assertEquals("At 2025-06-01 00:00:00", parser.getHumanReadable("at:2025-06-01T00:00:00+02:00"));
        assertEquals("At 2025-06-01 08:15:00", parser.getHumanReadable("at:2025-06-01T08:15:00Z"));

        // the fire instant is still the absolute one
        DateTrigger trigger = assertInstanceOf(DateTrigger.class, parser.parse("at:2025-06-01T00:00:00+02:00"));
        assertEquals(Instant.parse("2025-05-31T22:00:00Z"), trigger.runAt());
    }

    @Test
    void humanReadableShouldEchoUnknownSpecs() {
        assertEquals("bogus", parser.getHumanReadable("bogus"));
        assertEquals("every abc", parser.getHumanReadable("every abc"));
        assertEquals("At not-a-date", parser.getHumanReadable("at:not-a-date"));
        assertEquals("", parser.getHumanReadable(null));
    }

    @Test
    void humanReadableShouldBeDeterministic() {
        String spec = "cron:*/5 * * * *";
        assertEquals(parser.getHumanReadable(spec), parser.getHumanReadable(spec));
    }

    // ---- trigger info ----

    @Test
    void cronTriggerInfoShouldListFieldLiterals() {
        Map<String, Object> info = parser.getTriggerInfo(parser.parse("cron:0 9 * * 1-5"));

        assertEquals("cron", info.get("type"));
        assertEquals("0", info.get("minute"));
        assertEquals("9", info.get("hour"));
        assertEquals("*", info.get("day"));
        assertEquals("*", info.get("month"));
        assertEquals("1-5", info.get("day_of_week"));
    }

    @Test
    void intervalTriggerInfoShouldReportSeconds() {
        Map<String, Object> info = parser.getTriggerInfo(parser.parse("every 2h"));

        assertEquals("interval", info.get("type"));
        assertEquals(7200L, info.get("seconds"));
    }

    @Test
    void dateTriggerInfoShouldReportIsoInstant() {
        Map<String, Object> info = parser.getTriggerInfo(parser.parse("at:2025-06-01T00:00:30"));

        assertEquals("date", info.get("type"));
        assertEquals("2025-06-01T00:00:30Z", info.get("run_date"));
    }
}
