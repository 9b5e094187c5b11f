package io.cronbot.core.dispatch;

import io.cronbot.core.job.JobTarget;

public final class CapabilityNotFoundException extends DispatchException {

    public CapabilityNotFoundException(JobTarget target) {
        super(target, "Capability '" + target.capability() + "' not found on collaborator '" + target.collaborator() + "'");
    }
}
