package io.recur4j.exception;

/**
 * The external job creator failed. The instance stays scheduled, so the conversion can be retried.
 */
public class JobCreationException extends RecurringJobException {

    public JobCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
