package io.cronbot.core.dispatch;

import io.cronbot.core.job.JobTarget;

/**
 * The capability was found and invoked but threw. The message is the handler's own message.
 */
public final class CapabilityExecutionException extends Exception {
    private final JobTarget target;

    public CapabilityExecutionException(JobTarget target, Throwable cause) {
        super(messageOf(cause), cause);
        this.target = target;
    }

    public JobTarget target() {
        return target;
    }

    private static String messageOf(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
