package io.recur4j.exception;

/**
 * Base exception for recurring job series errors.
 */
public class RecurringJobException extends RuntimeException {

    public RecurringJobException(String message) {
        super(message);
    }

    public RecurringJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
