package io.recur4j.core;

import java.time.LocalDate;

/**
 * Options for one generation run.
 * <ul>
 *   <li>horizonDays: number of calendar days, starting today, to materialize; null means the configured default</li>
 *   <li>untilDate: inclusive last day of the window; takes precedence over horizonDays when set</li>
 * </ul>
 */
public record GenerationOptions(Integer horizonDays, LocalDate untilDate) {

    public static GenerationOptions defaults() {
        return new GenerationOptions(null, null);
    }

    public static GenerationOptions horizon(int horizonDays) {
        return new GenerationOptions(horizonDays, null);
    }

    public static GenerationOptions until(LocalDate untilDate) {
        return new GenerationOptions(null, untilDate);
    }
}
