package io.cronbot.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.cronbot.core.dispatch.Dispatcher;
import io.cronbot.core.dispatch.TargetRegistry;
import io.cronbot.core.job.JobParameters;
import io.cronbot.core.job.JobTarget;
import org.junit.jupiter.api.Test;

class CronbotApplicationTest {

    @Test
    void shouldRegisterCollaboratorsFromServiceLoader() throws Exception {
        TargetRegistry registry = new TargetRegistry();

        int registered = CronbotApplication.discoverCollaborators(registry, getClass().getClassLoader());

        assertThat(registered).isEqualTo(1);
        assertThat(registry.supports(JobTarget.of("echo", "say"))).isTrue();
        assertThat(new Dispatcher(registry).invoke(JobTarget.of("echo", "say"), JobParameters.positional("hi")))
            .isEqualTo("hi");
    }
}
