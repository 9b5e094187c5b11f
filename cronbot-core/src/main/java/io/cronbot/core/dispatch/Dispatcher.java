package io.cronbot.core.dispatch;

import io.cronbot.core.job.JobParameters;
import io.cronbot.core.job.JobTarget;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Dispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final TargetRegistry registry;

    public Dispatcher(TargetRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public boolean supports(JobTarget target) {
        return registry.supports(target);
    }

    public Object invoke(JobTarget target, JobParameters parameters)
        throws DispatchException, CapabilityExecutionException {
        Objects.requireNonNull(target, "target must not be null");
        JobCollaborator collaborator = registry.resolve(target.collaborator())
            .orElseThrow(() -> new TargetNotFoundException(target));
        Capability capability = collaborator.capability(target.capability())
            .orElseThrow(() -> new CapabilityNotFoundException(target));

        LOG.debug("Invoking {}", target);
        try {
            return capability.invoke(parameters == null ? JobParameters.empty() : parameters);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityExecutionException(target, e);
        } catch (Exception e) {
            throw new CapabilityExecutionException(target, e);
        }
    }
}
