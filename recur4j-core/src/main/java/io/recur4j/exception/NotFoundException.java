package io.recur4j.exception;

public class NotFoundException extends RecurringJobException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException series(String seriesId) {
        return new NotFoundException("Recurring series not found: " + seriesId);
    }

    public static NotFoundException instance(String seriesId, String instanceId) {
        return new NotFoundException("Recurring visit not found: series=" + seriesId + " instance=" + instanceId);
    }
}
