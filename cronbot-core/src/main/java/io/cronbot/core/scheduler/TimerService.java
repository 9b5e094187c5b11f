package io.cronbot.core.scheduler;

import java.time.Duration;

/**
 * Source of single-shot timers. Callbacks run on the service's own timer thread.
 */
public interface TimerService extends AutoCloseable {

    TimerHandle schedule(Runnable task, Duration delay);

    @Override
    void close();
}
