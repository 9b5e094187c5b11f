package io.cronbot.core.job;

/**
 * Symbolic reference to a capability exposed by a registered collaborator.
 */
public record JobTarget(String collaborator, String capability) {

    public JobTarget {
        if (collaborator == null || collaborator.isBlank()) {
            throw new IllegalArgumentException("collaborator must not be blank");
        }
        if (capability == null || capability.isBlank()) {
            throw new IllegalArgumentException("capability must not be blank");
        }
        collaborator = collaborator.trim();
        capability = capability.trim();
    }

    public static JobTarget of(String collaborator, String capability) {
        return new JobTarget(collaborator, capability);
    }

    @Override
    public String toString() {
        return collaborator + "." + capability;
    }
}
