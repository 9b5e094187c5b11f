package io.cronbot.core.scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ExecutorTimerService implements TimerService {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutorTimerService.class);

    private final ScheduledExecutorService executor;

    public ExecutorTimerService() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cronbot-timer");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public ExecutorTimerService(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public TimerHandle schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task must not be null");
        long millis = Math.max(0, delay.toMillis());
        ScheduledFuture<?> future = executor.schedule(() -> runGuarded(task), millis, TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Timer callback failed", e);
        }
    }

    private record FutureHandle(ScheduledFuture<?> future) implements TimerHandle {
        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isActive() {
            return !future.isDone();
        }
    }
}
