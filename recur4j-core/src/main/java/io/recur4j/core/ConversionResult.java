package io.recur4j.core;

public record ConversionResult(
        RecurringJobInstance instance,
        CreatedJob job
) {
}
