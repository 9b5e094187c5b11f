package io.cronbot.core.dispatch;

import io.cronbot.core.job.JobTarget;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class TargetRegistry {
    private final Map<String, JobCollaborator> collaborators = new ConcurrentHashMap<>();

    /**
     * Registers {@code collaborator}, replacing any previous one with the same name. The capability
     * map is validated and copied here so a bad registration fails now rather than when a job fires.
     */
    public void register(JobCollaborator collaborator) {
        if (collaborator == null) {
            throw new IllegalArgumentException("collaborator must not be null");
        }
        String name = collaborator.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("collaborator name must not be blank");
        }
        Map<String, Capability> capabilities = collaborator.capabilities();
        if (capabilities == null) {
            throw new IllegalArgumentException("collaborator '" + name + "' has no capability map");
        }
        capabilities.forEach((capabilityName, capability) -> {
            if (capabilityName == null || capabilityName.isBlank()) {
                throw new IllegalArgumentException("collaborator '" + name + "' exposes a capability with a blank name");
            }
            if (capability == null) {
                throw new IllegalArgumentException("capability '" + name + "." + capabilityName + "' is null");
            }
        });
        collaborators.put(name.trim(), JobCollaborator.of(name.trim(), capabilities));
    }

    public boolean unregister(String name) {
        return name != null && collaborators.remove(name.trim()) != null;
    }

    public Optional<JobCollaborator> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(collaborators.get(name.trim()));
    }

    public boolean supports(JobTarget target) {
        return resolve(target.collaborator())
            .flatMap(collaborator -> collaborator.capability(target.capability()))
            .isPresent();
    }

    public Collection<JobCollaborator> all() {
        return collaborators.values();
    }
}
