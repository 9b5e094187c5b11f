package io.cronbot.core.store;

import io.cronbot.core.job.JobValidationException;

public final class DuplicateJobNameException extends JobValidationException {
    private final String name;

    public DuplicateJobNameException(String name) {
        super("A job named '" + name + "' already exists");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
