package io.recur4j.core;

import io.recur4j.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecurrenceRuleTest {

    @Test
    void ofShouldDefaultIntervalToOne() {
        RecurrenceRule rule = RecurrenceRule.of(new RecurrenceSpec("daily", null, null, null));

        assertEquals(new RecurrenceRule.Daily(1), rule);
    }

    @Test
    void ofShouldMapSundayAsZero() {
        RecurrenceRule rule = RecurrenceRule.of(new RecurrenceSpec("weekly", 2, 0, null));

        RecurrenceRule.Weekly weekly = assertInstanceOf(RecurrenceRule.Weekly.class, rule);
        assertEquals(DayOfWeek.SUNDAY, weekly.dayOfWeek());
        assertEquals(2, weekly.interval());
        assertEquals(new RecurrenceSpec("weekly", 2, 0, null), rule.toSpec());
    }

    @Test
    void ofShouldAcceptPatternCaseInsensitively() {
        RecurrenceRule rule = RecurrenceRule.of(new RecurrenceSpec(" Monthly ", 1, null, 15));

        assertEquals(new RecurrenceRule.Monthly(1, 15), rule);
    }

    @Test
    void weeklyWithoutDayOfWeekShouldBeRejected() {
        assertThrows(ValidationException.class,
                () -> RecurrenceRule.of(new RecurrenceSpec("weekly", 1, null, null)));
    }

    @Test
    void monthlyWithoutDayOfMonthShouldBeRejected() {
        assertThrows(ValidationException.class,
                () -> RecurrenceRule.of(new RecurrenceSpec("monthly", 1, null, null)));
    }

    @Test
    void outOfRangeParametersShouldBeRejected() {
        assertThrows(ValidationException.class,
                () -> RecurrenceRule.of(new RecurrenceSpec("monthly", 1, null, 32)));
        assertThrows(ValidationException.class,
                () -> RecurrenceRule.of(new RecurrenceSpec("weekly", 1, 7, null)));
        assertThrows(ValidationException.class,
                () -> RecurrenceRule.of(new RecurrenceSpec("daily", 0, null, null)));
    }

    @Test
    void unknownPatternShouldBeRejected() {
        assertThrows(ValidationException.class,
                () -> RecurrenceRule.of(new RecurrenceSpec("fortnightly", 1, null, null)));
    }

    @Test
    void unrelatedParametersShouldBeDropped() {
        RecurrenceRule rule = RecurrenceRule.of(new RecurrenceSpec("quarterly", 1, 3, 12));

        assertEquals(new RecurrenceSpec("quarterly", 1, null, null), rule.toSpec());
    }
}
