package io.cronbot.core.dispatch;

import java.util.Map;
import java.util.Optional;

/**
 * An external component that scheduled jobs can call into, such as a task manager or digest module.
 */
public interface JobCollaborator {
    String name();

    Map<String, Capability> capabilities();

    default Optional<Capability> capability(String name) {
        return Optional.ofNullable(capabilities().get(name));
    }

    static JobCollaborator of(String name, Map<String, Capability> capabilities) {
        return new StaticCollaborator(name, Map.copyOf(capabilities));
    }

    record StaticCollaborator(String name, Map<String, Capability> capabilities) implements JobCollaborator {
    }
}
