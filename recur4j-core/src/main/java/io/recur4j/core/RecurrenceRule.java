package io.recur4j.core;

import io.recur4j.exception.ValidationException;

import java.time.DayOfWeek;
import java.util.Objects;

/**
 * Recurrence configuration of a series, one variant per pattern.
 *
 * <p>Each variant only carries the parameters its pattern needs, so a weekly rule without a
 * weekday or a monthly rule without a day of month cannot be constructed.
 */
public sealed interface RecurrenceRule
        permits RecurrenceRule.Daily,
        RecurrenceRule.Weekly,
        RecurrenceRule.Monthly,
        RecurrenceRule.Quarterly,
        RecurrenceRule.Yearly,
        RecurrenceRule.Custom {

    RecurrencePattern pattern();

    /**
     * Every {@code interval} days from the start date.
     */
    record Daily(int interval) implements RecurrenceRule {
        public Daily {
            requirePositiveInterval(interval);
        }

        @Override
        public RecurrencePattern pattern() {
            return RecurrencePattern.DAILY;
        }
    }

    /**
     * Every {@code interval} weeks on {@code dayOfWeek}, starting with the first such day on or
     * after the start date.
     */
    record Weekly(int interval, DayOfWeek dayOfWeek) implements RecurrenceRule {
        public Weekly {
            requirePositiveInterval(interval);
            if (dayOfWeek == null) {
                throw new ValidationException("weekly recurrence requires recurrenceDayOfWeek");
            }
        }

        @Override
        public RecurrencePattern pattern() {
            return RecurrencePattern.WEEKLY;
        }
    }

    /**
     * Day {@code dayOfMonth} of every {@code interval}-th month, clamped to the month length.
     */
    record Monthly(int interval, int dayOfMonth) implements RecurrenceRule {
        public Monthly {
            requirePositiveInterval(interval);
            if (dayOfMonth < 1 || dayOfMonth > 31) {
                throw new ValidationException("recurrenceDayOfMonth must be between 1 and 31: " + dayOfMonth);
            }
        }

        @Override
        public RecurrencePattern pattern() {
            return RecurrencePattern.MONTHLY;
        }
    }

    /**
     * Every {@code 3 * interval} months on the start date's day of month.
     */
    record Quarterly(int interval) implements RecurrenceRule {
        public Quarterly {
            requirePositiveInterval(interval);
        }

        @Override
        public RecurrencePattern pattern() {
            return RecurrencePattern.QUARTERLY;
        }
    }

    /**
     * Every {@code interval} years on the start date's month and day.
     */
    record Yearly(int interval) implements RecurrenceRule {
        public Yearly {
            requirePositiveInterval(interval);
        }

        @Override
        public RecurrencePattern pattern() {
            return RecurrencePattern.YEARLY;
        }
    }

    /**
     * No generation rule; instances have to be populated by other means.
     */
    record Custom() implements RecurrenceRule {
        @Override
        public RecurrencePattern pattern() {
            return RecurrencePattern.CUSTOM;
        }
    }

    static RecurrenceRule daily(int interval) {
        return new Daily(interval);
    }

    static RecurrenceRule weekly(int interval, DayOfWeek dayOfWeek) {
        return new Weekly(interval, dayOfWeek);
    }

    static RecurrenceRule monthly(int interval, int dayOfMonth) {
        return new Monthly(interval, dayOfMonth);
    }

    static RecurrenceRule quarterly(int interval) {
        return new Quarterly(interval);
    }

    static RecurrenceRule yearly(int interval) {
        return new Yearly(interval);
    }

    static RecurrenceRule custom() {
        return new Custom();
    }

    /**
     * Builds a rule from its flat form, rejecting missing or out-of-range pattern parameters.
     * Parameters that do not belong to the pattern are ignored.
     */
    static RecurrenceRule of(RecurrenceSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");

        RecurrencePattern pattern = RecurrencePattern.fromWireName(spec.pattern());
        int interval = spec.interval() == null ? 1 : spec.interval();

        return switch (pattern) {
            case DAILY -> new Daily(interval);
            case WEEKLY -> {
                if (spec.dayOfWeek() == null) {
                    throw new ValidationException("weekly recurrence requires recurrenceDayOfWeek");
                }
                yield new Weekly(interval, toDayOfWeek(spec.dayOfWeek()));
            }
            case MONTHLY -> {
                if (spec.dayOfMonth() == null) {
                    throw new ValidationException("monthly recurrence requires recurrenceDayOfMonth");
                }
                yield new Monthly(interval, spec.dayOfMonth());
            }
            case QUARTERLY -> new Quarterly(interval);
            case YEARLY -> new Yearly(interval);
            case CUSTOM -> new Custom();
        };
    }

    /**
     * Reverse of {@link #of(RecurrenceSpec)}.
     */
    default RecurrenceSpec toSpec() {
        RecurrenceRule rule = this;
        if (rule instanceof Daily d) {
            return new RecurrenceSpec(pattern().wireName(), d.interval(), null, null);
        }
        if (rule instanceof Weekly w) {
            return new RecurrenceSpec(pattern().wireName(), w.interval(), fromDayOfWeek(w.dayOfWeek()), null);
        }
        if (rule instanceof Monthly m) {
            return new RecurrenceSpec(pattern().wireName(), m.interval(), null, m.dayOfMonth());
        }
        if (rule instanceof Quarterly q) {
            return new RecurrenceSpec(pattern().wireName(), q.interval(), null, null);
        }
        if (rule instanceof Yearly y) {
            return new RecurrenceSpec(pattern().wireName(), y.interval(), null, null);
        }
        return new RecurrenceSpec(pattern().wireName(), null, null, null);
    }

    /**
     * 0=Sunday ... 6=Saturday.
     */
    static DayOfWeek toDayOfWeek(int value) {
        if (value < 0 || value > 6) {
            throw new ValidationException("recurrenceDayOfWeek must be between 0 (Sunday) and 6 (Saturday): " + value);
        }
        return value == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(value);
    }

    static int fromDayOfWeek(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    private static void requirePositiveInterval(int interval) {
        if (interval < 1) {
            throw new ValidationException("recurrenceInterval must be at least 1: " + interval);
        }
    }
}
