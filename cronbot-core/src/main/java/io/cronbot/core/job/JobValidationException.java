package io.cronbot.core.job;

/**
 * Raised synchronously to callers of the job creation API when a request can never succeed.
 * Never retried.
 */
public class JobValidationException extends IllegalArgumentException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
