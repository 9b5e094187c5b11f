package io.cronbot.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cronbot.core.job.JobTarget;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TargetRegistryTest {

    @Test
    void shouldRegisterAndResolveCollaborator() {
        TargetRegistry registry = new TargetRegistry();
        registry.register(JobCollaborator.of("tasks", Map.of("remind", parameters -> "sent")));

        assertThat(registry.resolve("tasks")).isPresent();
        assertThat(registry.supports(JobTarget.of("tasks", "remind"))).isTrue();
        assertThat(registry.supports(JobTarget.of("tasks", "archive"))).isFalse();
        assertThat(registry.supports(JobTarget.of("digest", "send"))).isFalse();
    }

    @Test
    void shouldValidateCapabilityMapAtRegistration() {
        TargetRegistry registry = new TargetRegistry();
        Map<String, Capability> withNull = new HashMap<>();
        withNull.put("remind", null);

        assertThatThrownBy(() -> registry.register(JobCollaborator.of(" ", Map.of())))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(new BrokenCollaborator(withNull)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tasks.remind");
        assertThat(registry.all()).isEmpty();
    }

    @Test
    void shouldSnapshotCapabilitiesAndSupportUnregister() {
        TargetRegistry registry = new TargetRegistry();
        Map<String, Capability> capabilities = new HashMap<>();
        capabilities.put("remind", parameters -> "sent");
        registry.register(new BrokenCollaborator(capabilities));

        capabilities.put("archive", parameters -> "archived");

        assertThat(registry.supports(JobTarget.of("tasks", "archive"))).isFalse();
        assertThat(registry.unregister("tasks")).isTrue();
        assertThat(registry.resolve("tasks")).isEmpty();
        assertThat(registry.unregister("tasks")).isFalse();
    }

    private record BrokenCollaborator(Map<String, Capability> capabilities) implements JobCollaborator {
        @Override
        public String name() {
            return "tasks";
        }
    }
}
