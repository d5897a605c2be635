package io.recur4j.utils;

import io.recur4j.core.RecurrenceRule;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expands a {@link RecurrenceRule} into concrete calendar dates.
 * <p>
 * Expansion rules:
 * <ul>
 *   <li>daily: startDate + k * interval days</li>
 *   <li>weekly: first dayOfWeek on or after startDate, then every interval weeks</li>
 *   <li>monthly: dayOfMonth of every interval-th month counted from startDate's month</li>
 *   <li>quarterly: startDate's day of month, every 3 * interval months</li>
 *   <li>yearly: startDate's month and day, every interval years</li>
 *   <li>custom: nothing</li>
 * </ul>
 * Month-based days that do not exist in a month are clamped to its last day
 * (31 -> 30 in April, 31 -> 28/29 in February, Feb 29 -> Feb 28 on non-leap years).
 * <p>
 * The result is always ascending, free of duplicates, and inside both the requested window and
 * the series validity range. Expansion jumps straight to the first candidate in the window, so a
 * series that started years ago costs no more than a new one.
 */
public final class DateSequenceGenerator {
    private DateSequenceGenerator() {
    }

    /**
     * Convenience overload without a result cap.
     */
    public static List<LocalDate> generate(RecurrenceRule rule,
                                           LocalDate startDate,
                                           LocalDate endDate,
                                           LocalDate from,
                                           LocalDate to) {
        return generate(rule, startDate, endDate, from, to, Integer.MAX_VALUE);
    }

    /**
     * @param rule      recurrence rule of the series
     * @param startDate first day of the series (inclusive)
     * @param endDate   last day of the series (inclusive); null for open-ended series
     * @param from      first day of the window (inclusive)
     * @param to        last day of the window (inclusive)
     * @param limit     maximum number of dates returned; must be positive
     * @return candidate dates, ascending
     */
    public static List<LocalDate> generate(RecurrenceRule rule,
                                           LocalDate startDate,
                                           LocalDate endDate,
                                           LocalDate from,
                                           LocalDate to,
                                           int limit) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(startDate, "startDate must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }

        LocalDate lower = laterOf(startDate, from);
        LocalDate upper = endDate == null ? to : earlierOf(endDate, to);
        if (lower.isAfter(upper)) {
            return List.of();
        }

        if (rule instanceof RecurrenceRule.Daily d) {
            return fixedStep(startDate, d.interval(), lower, upper, limit);
        }
        if (rule instanceof RecurrenceRule.Weekly w) {
            LocalDate anchor = startDate.with(TemporalAdjusters.nextOrSame(w.dayOfWeek()));
            return fixedStep(anchor, 7L * w.interval(), lower, upper, limit);
        }
        if (rule instanceof RecurrenceRule.Monthly m) {
            return monthStep(startDate, m.interval(), m.dayOfMonth(), lower, upper, limit);
        }
        if (rule instanceof RecurrenceRule.Quarterly q) {
            return monthStep(startDate, 3L * q.interval(), startDate.getDayOfMonth(), lower, upper, limit);
        }
        if (rule instanceof RecurrenceRule.Yearly y) {
            return monthStep(startDate, 12L * y.interval(), startDate.getDayOfMonth(), lower, upper, limit);
        }
        return List.of();
    }

    /* ================= helper ================= */

    private static List<LocalDate> fixedStep(LocalDate anchor, long stepDays,
                                             LocalDate lower, LocalDate upper, int limit) {
        long span = ChronoUnit.DAYS.between(anchor, upper);
        long k = 0;
        long offset = ChronoUnit.DAYS.between(anchor, lower);
        if (offset > 0) {
            k = ceilDiv(offset, stepDays);
        }

        // bounded by span: no date past upper is ever built
        List<LocalDate> dates = new ArrayList<>();
        while (k * stepDays <= span && dates.size() < limit) {
            dates.add(anchor.plusDays(k * stepDays));
            k++;
        }
        return dates;
    }

    private static List<LocalDate> monthStep(LocalDate startDate, long stepMonths, int dayOfMonth,
                                             LocalDate lower, LocalDate upper, int limit) {
        YearMonth base = YearMonth.from(startDate);
        long monthsToLower = ChronoUnit.MONTHS.between(base, YearMonth.from(lower));
        long monthsToUpper = ChronoUnit.MONTHS.between(base, YearMonth.from(upper));
        long k = Math.max(0, Math.floorDiv(monthsToLower, stepMonths));

        List<LocalDate> dates = new ArrayList<>();
        while (k * stepMonths <= monthsToUpper && dates.size() < limit) {
            LocalDate candidate = clampedDay(base.plusMonths(k * stepMonths), dayOfMonth);
            k++;
            if (candidate.isAfter(upper)) {
                break;
            }
            if (candidate.isBefore(lower)) {
                continue;
            }
            dates.add(candidate);
        }
        return dates;
    }

    private static LocalDate clampedDay(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }

    private static long ceilDiv(long x, long y) {
        return -Math.floorDiv(-x, y);
    }

    private static LocalDate laterOf(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalDate earlierOf(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }
}
