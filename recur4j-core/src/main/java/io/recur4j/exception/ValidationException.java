package io.recur4j.exception;

/**
 * Malformed series configuration or request arguments. Never retried automatically.
 */
public class ValidationException extends RecurringJobException {

    public ValidationException(String message) {
        super(message);
    }
}
