package io.taskrunr.trigger;

import java.time.Duration;

/**
 * Units accepted by the {@code every <N><unit>} and {@code in <N><unit>} grammars.
 */
public enum IntervalUnit {
    SECONDS('s', Duration.ofSeconds(1), "second"),
    MINUTES('m', Duration.ofMinutes(1), "minute"),
    HOURS('h', Duration.ofHours(1), "hour"),
    DAYS('d', Duration.ofDays(1), "day");

    private final char symbol;
    private final Duration length;
    private final String word;

    IntervalUnit(char symbol, Duration length, String word) {
        this.symbol = symbol;
        this.length = length;
        this.word = word;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * Returns {@code count} of this unit as a duration.
     *
     * @throws ArithmeticException if the result overflows
     */
    public Duration times(long count) {
        return length.multipliedBy(count);
    }

    /**
     * Returns the English unit word, pluralized for any count other than 1.
     */
    public String word(long count) {
        return count == 1 ? word : word + "s";
    }

    public static IntervalUnit fromSymbol(char symbol) {
        for (IntervalUnit unit : values()) {
            if (unit.symbol == symbol) return unit;
        }
        throw new ScheduleParseException("Unsupported interval unit: " + symbol);
    }
}
