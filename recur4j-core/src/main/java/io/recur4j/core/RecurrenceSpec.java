package io.recur4j.core;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Flat wire/storage form of a {@link RecurrenceRule}.
 *
 * <ul>
 *   <li>pattern: daily, weekly, monthly, quarterly, yearly or custom</li>
 *   <li>interval: every N units; null means 1</li>
 *   <li>dayOfWeek: 0=Sunday ... 6=Saturday (weekly only)</li>
 *   <li>dayOfMonth: 1-31 (monthly only)</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecurrenceSpec(
        String pattern,
        Integer interval,
        Integer dayOfWeek,
        Integer dayOfMonth
) {
}
