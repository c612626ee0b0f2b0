package io.taskrunr.trigger;

import java.util.BitSet;
import java.util.stream.Collectors;
import java.util.regex.Pattern;

/**
 * One field of a five-field crontab expression.
 *
 * <p>Accepts {@code *}, a single value, a range {@code a-b}, a comma list of values
 * and ranges, or a step {@code *}{@code /n}. Values outside {@code [min, max]} are rejected.
 * Only validation happens here; fire times come from {@link CronTrigger}.</p>
 */
public final class CronField {

    private static final Pattern STEP = Pattern.compile("\\*/(\\d{1,3})");
    private static final Pattern ITEM = Pattern.compile("(\\d{1,2})(?:-(\\d{1,2}))?");

    private final String name;
    private final String literal;
    private final BitSet allowed;

    private CronField(String name, String literal, BitSet allowed) {
        this.name = name;
        this.literal = literal;
        this.allowed = allowed;
    }

    /**
     * Parses a field literal.
     *
     * @param name    field name used in error messages and trigger info
     * @param literal the raw field text
     * @param min     smallest legal value
     * @param max     largest legal value
     * @throws ScheduleParseException if the literal does not match the field grammar
     */
    public static CronField parse(String name, String literal, int min, int max) {
        BitSet allowed = new BitSet(max + 1);

        if ("*".equals(literal)) {
            allowed.set(min, max + 1);
            return new CronField(name, literal, allowed);
        }

        var step = STEP.matcher(literal);
        if (step.matches()) {
            int n = Integer.parseInt(step.group(1));
            if (n == 0) {
                throw new ScheduleParseException("Step must be positive in " + name + " field: " + literal);
            }
            for (int v = min; v <= max; v += n) {
                allowed.set(v);
            }
            return new CronField(name, literal, allowed);
        }

        for (String item : literal.split(",", -1)) {
            var m = ITEM.matcher(item);
            if (!m.matches()) {
                throw new ScheduleParseException("Invalid " + name + " field: " + literal);
            }
            int from = Integer.parseInt(m.group(1));
            int to = m.group(2) != null ? Integer.parseInt(m.group(2)) : from;
            if (from < min || to > max || from > to) {
                throw new ScheduleParseException(
                        "Value out of range %d-%d in %s field: %s".formatted(min, max, name, literal));
            }
            allowed.set(from, to + 1);
        }
        return new CronField(name, literal, allowed);
    }

    /**
     * Returns the allowed values as an explicit comma list, e.g. {@code 0,2,4,6} for
     * {@code *}{@code /2} in the day-of-week field.
     */
    public String values() {
        return allowed.stream()
                .mapToObj(Integer::toString)
                .collect(Collectors.joining(","));
    }

    public String name() {
        return name;
    }

    public String literal() {
        return literal;
    }

    @Override
    public String toString() {
        return literal;
    }
}
