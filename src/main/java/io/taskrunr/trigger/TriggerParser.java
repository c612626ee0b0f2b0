package io.taskrunr.trigger;

import io.taskrunr.config.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns schedule specs into trigger descriptors.
 *
 * <p>Supported grammars:</p>
 * <pre>
 * cron:&lt;m&gt; &lt;h&gt; &lt;dom&gt; &lt;mon&gt; &lt;dow&gt;   e.g. "cron:0 9 * * 1-5"
 * every &lt;N&gt;&lt;unit&gt;                 e.g. "every 30m"
 * at:&lt;ISO-8601 instant&gt;            e.g. "at:2025-06-01T00:00:00"
 * in &lt;N&gt;&lt;unit&gt;                    e.g. "in 2h"
 * </pre>
 * Units are {@code s}, {@code m}, {@code h} and {@code d}. Timestamps without an
 * offset are read in the scheduler time zone.
 */
@Component
public class TriggerParser {

    private static final Logger log = LoggerFactory.getLogger(TriggerParser.class);

    public static final String CRON_PREFIX = "cron:";
    public static final String INTERVAL_PREFIX = "every ";
    public static final String DATE_PREFIX = "at:";
    public static final String RELATIVE_PREFIX = "in ";

    private static final Pattern AMOUNT = Pattern.compile("^(\\d+)([smhd])$");
    private static final DateTimeFormatter HUMAN_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ZoneId zone;
    private final Clock clock;

    @Autowired
    public TriggerParser(SchedulerProperties properties) {
        this(properties.zoneId(), Clock.system(properties.zoneId()));
    }

    public TriggerParser(ZoneId zone, Clock clock) {
        this.zone = zone;
        this.clock = clock;
    }

    public TriggerDescriptor parse(String spec) {
        return parse(spec, null);
    }

    /**
     * Parses a schedule spec.
     *
     * @param spec      the schedule spec
     * @param startTime optional anchor for interval triggers, ignored by the other grammars
     * @return the parsed trigger
     * @throws ScheduleParseException if the spec is malformed
     */
    public TriggerDescriptor parse(String spec, Instant startTime) {
        if (spec == null) {
            throw new ScheduleParseException("unrecognized schedule format: null");
        }
        if (spec.startsWith(CRON_PREFIX)) {
            return parseCron(spec.substring(CRON_PREFIX.length()).trim());
        }
        if (spec.startsWith(INTERVAL_PREFIX)) {
            return parseInterval(spec.substring(INTERVAL_PREFIX.length()).trim(), startTime);
        }
        if (spec.startsWith(DATE_PREFIX)) {
            return parseDate(spec.substring(DATE_PREFIX.length()).trim());
        }
        if (spec.startsWith(RELATIVE_PREFIX)) {
            return parseRelative(spec.substring(RELATIVE_PREFIX.length()).trim(), clock.instant());
        }
        throw new ScheduleParseException("unrecognized schedule format: " + spec);
    }

    /**
     * Resolves the fire instant of a one-shot spec ({@code at:} or {@code in }).
     * Relative specs are measured from {@code createdAt}, so a reload does not push them back.
     *
     * @return the fire instant, or null if the spec is not a one-shot spec or cannot be parsed
     */
    public Instant resolveOneShot(String spec, Instant createdAt) {
        try {
            if (spec.startsWith(DATE_PREFIX)) {
                return parseDate(spec.substring(DATE_PREFIX.length()).trim()).runAt();
            }
            if (spec.startsWith(RELATIVE_PREFIX)) {
                Instant base = createdAt != null ? createdAt : clock.instant();
                return parseRelative(spec.substring(RELATIVE_PREFIX.length()).trim(), base).runAt();
            }
        } catch (ScheduleParseException e) {
            log.debug("Not a resolvable one-shot spec '{}': {}", spec, e.getMessage());
        }
        return null;
    }

    /**
     * Returns trigger fields for API responses.
     */
    public Map<String, Object> getTriggerInfo(TriggerDescriptor trigger) {
        return trigger.info();
    }

    /**
     * Returns a human-readable description of a spec. Never throws; unknown specs are echoed back.
     */
    public String getHumanReadable(String spec) {
        if (spec == null) return "";
        if (spec.startsWith(CRON_PREFIX)) {
            return "Cron schedule: " + spec.substring(CRON_PREFIX.length()).trim();
        }
        if (spec.startsWith(INTERVAL_PREFIX)) {
            return describeAmount("Every", spec.substring(INTERVAL_PREFIX.length()).trim(), spec);
        }
        if (spec.startsWith(DATE_PREFIX)) {
            String value = spec.substring(DATE_PREFIX.length()).trim();
            try {
                return "At " + HUMAN_DATE.format(parseWallTime(value));
            } catch (DateTimeException e) {
                return "At " + value;
            }
        }
        if (spec.startsWith(RELATIVE_PREFIX)) {
            return describeAmount("In", spec.substring(RELATIVE_PREFIX.length()).trim(), spec);
        }
        return spec;
    }

    public ZoneId zone() {
        return zone;
    }

    private CronTrigger parseCron(String expression) {
        String[] parts = expression.split("\\s+");
        if (parts.length != 5) {
            throw new ScheduleParseException("Cron expression must have 5 fields: " + expression);
        }
        return CronTrigger.of(
                CronField.parse("minute", parts[0], 0, 59),
                CronField.parse("hour", parts[1], 0, 23),
                CronField.parse("day", parts[2], 1, 31),
                CronField.parse("month", parts[3], 1, 12),
                CronField.parse("day_of_week", parts[4], 0, 6),
                zone);
    }

    private IntervalTrigger parseInterval(String amount, Instant startTime) {
        Matcher m = matchAmount(amount, "interval");
        long count = parseCount(m.group(1), amount);
        IntervalUnit unit = IntervalUnit.fromSymbol(m.group(2).charAt(0));
        Instant anchor = startTime != null ? startTime : clock.instant();
        try {
            var trigger = new IntervalTrigger(count, unit, anchor);
            trigger.nextFireTime(anchor);
            return trigger;
        } catch (ArithmeticException | DateTimeException e) {
            throw new ScheduleParseException("Interval out of range: " + amount, e);
        }
    }

    private DateTrigger parseDate(String value) {
        Instant runAt;
        try {
            runAt = parseInstant(value);
        } catch (DateTimeException e) {
            throw new ScheduleParseException("Invalid date: " + value, e);
        }
        if (!runAt.isAfter(clock.instant())) {
            log.warn("Date is in the past: {}", value);
        }
        return new DateTrigger(runAt, zone);
    }

    private DateTrigger parseRelative(String amount, Instant base) {
        Matcher m = matchAmount(amount, "relative");
        long count = parseCount(m.group(1), amount);
        IntervalUnit unit = IntervalUnit.fromSymbol(m.group(2).charAt(0));
        try {
            return new DateTrigger(base.plus(unit.times(count)), zone);
        } catch (ArithmeticException | DateTimeException e) {
            throw new ScheduleParseException("Relative time out of range: " + amount, e);
        }
    }

    /**
     * Reads an ISO-8601 timestamp with an offset, a local date-time in the scheduler zone,
     * or a bare date at midnight in the scheduler zone.
     */
    Instant parseInstant(String value) {
        return parseWallTime(value).toInstant();
    }

    /**
     * Like {@link #parseInstant} but keeps the offset the timestamp was written in.
     */
    private ZonedDateTime parseWallTime(String value) {
        String iso = value.replace(' ', 'T');
        if (iso.indexOf('T') < 0) {
            return LocalDate.parse(iso).atStartOfDay(zone);
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(iso, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toZonedDateTime();
        }
        return ((LocalDateTime) parsed).atZone(zone);
    }

    private Matcher matchAmount(String amount, String kind) {
        Matcher m = AMOUNT.matcher(amount);
        if (!m.matches()) {
            throw new ScheduleParseException("Invalid %s specification: %s".formatted(kind, amount));
        }
        return m;
    }

    private long parseCount(String digits, String amount) {
        long count;
        try {
            count = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new ScheduleParseException("Value out of range: " + amount, e);
        }
        if (count <= 0) {
            throw new ScheduleParseException("Value must be positive: " + amount);
        }
        return count;
    }

    private String describeAmount(String prefix, String amount, String spec) {
        Matcher m = AMOUNT.matcher(amount);
        if (!m.matches()) return spec;
        long count;
        try {
            count = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return spec;
        }
        IntervalUnit unit = IntervalUnit.fromSymbol(m.group(2).charAt(0));
        return "%s %d %s".formatted(prefix, count, unit.word(count));
    }
}
