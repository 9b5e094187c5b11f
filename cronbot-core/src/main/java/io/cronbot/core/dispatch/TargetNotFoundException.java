package io.cronbot.core.dispatch;

import io.cronbot.core.job.JobTarget;

public final class TargetNotFoundException extends DispatchException {

    public TargetNotFoundException(JobTarget target) {
        super(target, "Collaborator '" + target.collaborator() + "' is not registered");
    }
}
