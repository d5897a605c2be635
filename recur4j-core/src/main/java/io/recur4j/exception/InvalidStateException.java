package io.recur4j.exception;

/**
 * Illegal instance lifecycle transition. The instance is left untouched.
 */
public class InvalidStateException extends RecurringJobException {

    public InvalidStateException(String message) {
        super(message);
    }
}
