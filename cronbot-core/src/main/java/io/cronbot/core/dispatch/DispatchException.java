package io.cronbot.core.dispatch;

import io.cronbot.core.job.JobTarget;

/**
 * A job target could not be resolved to an invocable capability.
 */
public abstract class DispatchException extends Exception {
    private final JobTarget target;

    protected DispatchException(JobTarget target, String message) {
        super(message);
        this.target = target;
    }

    public JobTarget target() {
        return target;
    }
}
