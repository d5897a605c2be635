package io.recur4j.core;

import io.recur4j.exception.ValidationException;

import java.util.Locale;

public enum RecurrencePattern {
    DAILY,
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    YEARLY,
    CUSTOM;

    /**
     * Lower-case name used on the wire and in storage (e.g. "weekly").
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RecurrencePattern fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("recurrencePattern must not be blank");
        }
        try {
            return RecurrencePattern.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Unsupported recurrencePattern: " + value);
        }
    }
}
